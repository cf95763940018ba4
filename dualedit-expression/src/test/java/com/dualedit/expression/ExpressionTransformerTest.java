package com.dualedit.expression;

import com.dualedit.expression.ast.ExpressionAnalysis;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.text.ParseResult;
import com.dualedit.expression.visual.ConversionResult;
import com.dualedit.expression.visual.VisualNode;
import com.dualedit.expression.visual.VisualNodeJson;
import com.dualedit.expression.visual.VisualNodeKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionTransformerTest {

    private final ExpressionTransformer transformer = new ExpressionTransformer();

    @Test
    void analyzeText_reportsFunctionsAndVariables() {
        Optional<ExpressionAnalysis> analysis = transformer.analyzeText("equalText(name, \"John\") and age > 18");

        assertTrue(analysis.isPresent());
        assertEquals(Set.of("equalText"), analysis.get().functions());
        assertEquals(Set.of("name", "age"), analysis.get().variables());
    }

    @Test
    void analyzeText_excludesReservedConstants() {
        ExpressionAnalysis analysis = transformer.analyzeText("2 * pi * r + e").orElseThrow();

        assertEquals(Set.of("r"), analysis.variables());
    }

    @Test
    void analyzeText_emptyWhenTextDoesNotParse() {
        assertFalse(transformer.analyzeText("1 +").isPresent());
    }

    @Test
    void formatText_dropsRedundantParentheses() {
        assertEquals(Optional.of("a + b * c"), transformer.formatText("((a)) + (b*c)"));
        assertEquals(Optional.of("(a + b) * c"), transformer.formatText("(a+b)*c"));
        assertEquals(Optional.empty(), transformer.formatText("(a"));
    }

    @Test
    void visualJson_toText_andBack() {
        String json = """
                {
                  "kind": "logic_operation",
                  "id": "and1",
                  "fields": { "OP": "AND" },
                  "slots": {
                    "A": {
                      "kind": "math_function_dual", "id": "f1", "fields": { "FUNC": "equalText" },
                      "slots": {
                        "ARG1": { "kind": "math_variable", "id": "v1", "fields": { "VAR": "name" } },
                        "ARG2": { "kind": "text_string", "id": "s1", "fields": { "TEXT": "John" } }
                      }
                    },
                    "B": {
                      "kind": "logic_compare", "id": "c1", "fields": { "OP": "GT" },
                      "slots": {
                        "A": { "kind": "math_variable", "id": "v2", "fields": { "VAR": "age" } },
                        "B": { "kind": "math_number", "id": "n1", "fields": { "NUM": 18 } }
                      }
                    }
                  }
                }
                """;

        ConversionResult<IntermediateNode> tree = transformer.visualToIntermediate(VisualNodeJson.fromJson(json));
        String text = transformer.intermediateToText(tree.node());

        assertFalse(tree.hasIssues());
        assertEquals("equalText(name, \"John\") and age > 18", text);
        assertTrue(transformer.validate(tree.node()).isValid());

        ParseResult<IntermediateNode> reparsed = transformer.textToIntermediate(text);
        VisualNode visual = transformer.intermediateToVisual(reparsed.getNode());
        assertEquals(VisualNodeKind.LOGIC_OPERATION, visual.getKindType());
        assertEquals("name", visual.slot("A").slot("ARG1").field("VAR"));
    }
}
