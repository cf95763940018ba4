package com.dualedit.expression.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NameHeuristicTypeHintTest {

    private final NameHeuristicTypeHint hint = new NameHeuristicTypeHint();

    @ParameterizedTest
    @ValueSource(strings = {"name", "firstName", "userEmail", "strValue", "msgBody", "filePath", "orderId", "status"})
    void typeOf_textualNamesAreStrings(String variable) {
        assertEquals(ValueType.STRING, hint.typeOf(variable));
    }

    @ParameterizedTest
    @ValueSource(strings = {"x", "age", "count", "total", "price", "y2"})
    void typeOf_otherNamesAreNumbers(String variable) {
        assertEquals(ValueType.NUMBER, hint.typeOf(variable));
    }

    @Test
    void typeOf_matchesBySubstring() {
        assertEquals(ValueType.STRING, hint.typeOf("width"));
    }
}
