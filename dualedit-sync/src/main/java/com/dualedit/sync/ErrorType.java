package com.dualedit.sync;

import java.util.Locale;

/**
 * Known sync failure codes. Codes are passed around as strings (a backing service may report codes this
 * version does not know); {@link #fromCode(String)} maps anything unrecognized to {@link #UNKNOWN}.
 */
public enum ErrorType {
    SYNC_TIMEOUT(ErrorClassification.SYSTEM),
    SERVICE_UNAVAILABLE(ErrorClassification.SYSTEM),
    NETWORK_ERROR(ErrorClassification.SYSTEM),
    PERFORMANCE_ISSUE(ErrorClassification.SYSTEM),
    RUNTIME_ERROR(ErrorClassification.SYSTEM),
    RESOURCE_EXHAUSTION(ErrorClassification.SYSTEM),
    FORMAT_ERROR(ErrorClassification.DATA),
    VALIDATION_ERROR(ErrorClassification.DATA),
    SYNTAX_ERROR(ErrorClassification.DATA),
    SCHEMA_MISMATCH(ErrorClassification.DATA),
    DATA_INTEGRITY_VIOLATION(ErrorClassification.DATA),
    DEPRECATED_FEATURE(ErrorClassification.DATA),
    UNKNOWN(ErrorClassification.UNKNOWN);

    private final ErrorClassification classification;

    ErrorType(ErrorClassification classification) {
        this.classification = classification;
    }

    public ErrorClassification classification() {
        return classification;
    }

    public static ErrorType fromCode(String code) {
        if (code == null || code.isBlank()) return UNKNOWN;
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (ErrorType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        return UNKNOWN;
    }
}
