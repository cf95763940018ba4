package com.dualedit.expression.validation;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Treats a variable as a string when its name looks textual: it contains a word such as {@code name},
 * {@code text} or {@code email}, starts with a textual prefix ({@code str}, {@code msg}, ...), ends with a
 * textual suffix ({@code Id}, {@code Path}, ...) or has such a camel-case segment. Everything else is a number.
 * <p>
 * Matching is by substring, so it is easily fooled ({@code width} contains {@code id}).
 */
public final class NameHeuristicTypeHint implements VariableTypeHint {

    private static final List<String> STRING_WORDS = List.of(
            "name", "text", "str", "msg", "message", "title", "content",
            "leak", "word", "phrase", "sentence", "label", "tag",
            "id", "key", "value", "data", "info", "desc", "description",
            "path", "url", "link", "file", "dir", "folder", "email",
            "user", "username", "password", "token", "code", "hash",
            "type", "kind", "category", "class", "status", "state");

    private static final Pattern PREFIX = Pattern.compile("^(str|txt|msg|text|name|user|pass)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUFFIX = Pattern.compile(
            "(string|text|name|msg|message|word|phrase|title|label|tag|id|key|path|url|email)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAMEL_SEGMENT = Pattern.compile(
            "[A-Z](Name|Text|Msg|Message|String|Word|Title|Label|Tag|Id|Key|Path|Url|Email)");

    @Override
    public ValueType typeOf(String variableName) {
        return looksTextual(variableName) ? ValueType.STRING : ValueType.NUMBER;
    }

    static boolean looksTextual(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String word : STRING_WORDS) {
            if (lower.contains(word)) return true;
        }
        return PREFIX.matcher(name).find()
                || SUFFIX.matcher(name).find()
                || CAMEL_SEGMENT.matcher(name).find();
    }
}
