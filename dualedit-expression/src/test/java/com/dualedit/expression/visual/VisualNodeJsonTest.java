package com.dualedit.expression.visual;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VisualNodeJsonTest {

    @Test
    void fromJson_readsNestedBlocks() {
        String json = """
                {
                  "kind": "math_arithmetic",
                  "id": "b1",
                  "fields": { "OP": "ADD" },
                  "slots": {
                    "A": { "kind": "math_number", "id": "b2", "fields": { "NUM": 1 } },
                    "B": { "kind": "math_variable", "id": "b3", "fields": { "VAR": "x" } }
                  },
                  "position": { "x": 10, "y": 20 }
                }
                """;

        VisualNode node = VisualNodeJson.fromJson(json);

        assertEquals(VisualNodeKind.MATH_ARITHMETIC, node.getKindType());
        assertEquals("ADD", node.field("OP"));
        assertEquals(1.0, node.slot("A").field("NUM"));
        assertEquals("x", node.slot("B").field("VAR"));
        assertNull(node.getNext());
    }

    @Test
    void fromJson_unknownKindIsKeptVerbatim() {
        VisualNode node = VisualNodeJson.fromJson("""
                { "kind": "colour_picker", "id": "c" }
                """);

        assertEquals("colour_picker", node.getKind());
        assertEquals(VisualNodeKind.UNKNOWN, node.getKindType());
    }

    @Test
    void toJson_omitsEmptyMapsAndNulls() {
        VisualNode node = VisualNode.builder(VisualNodeKind.LOGIC_BOOLEAN).id("t").field("BOOL", "TRUE").build();

        String json = VisualNodeJson.toJson(node);

        assertFalse(json.contains("slots"));
        assertFalse(json.contains("next"));
        assertFalse(json.contains("kindType"));
        assertEquals(node, VisualNodeJson.fromJson(json));
    }

    @Test
    void toJson_thenFromJson_keepsNextChain() {
        VisualNode chain = VisualNode.builder(VisualNodeKind.FUNCTION_CALL).id("f").field("FUNC", "max")
                .slot("ARGS", VisualNode.builder(VisualNodeKind.MATH_NUMBER).field("NUM", 1)
                        .next(VisualNode.builder(VisualNodeKind.MATH_NUMBER).field("NUM", 2).build()).build())
                .build();

        VisualNode back = VisualNodeJson.fromJson(VisualNodeJson.toJson(chain));

        assertEquals(chain, back);
        assertTrue(VisualNodeJson.toJson(chain).contains("\"next\""));
    }

    @Test
    void fromJson_malformedInputThrows() {
        assertThrows(UncheckedIOException.class, () -> VisualNodeJson.fromJson("{ \"kind\": "));
    }

    @Test
    void fields_rejectNonPrimitiveValues() {
        assertThrows(IllegalArgumentException.class,
                () -> VisualNode.builder(VisualNodeKind.MATH_NUMBER).field("NUM", new Object()).build());
    }
}
