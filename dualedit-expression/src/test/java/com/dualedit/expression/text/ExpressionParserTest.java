package com.dualedit.expression.text;

import com.dualedit.expression.ast.ConstantNode;
import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.GroupingNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.IntermediateNodes;
import com.dualedit.expression.ast.Operator;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static com.dualedit.expression.ast.Trees.bool;
import static com.dualedit.expression.ast.Trees.call;
import static com.dualedit.expression.ast.Trees.group;
import static com.dualedit.expression.ast.Trees.num;
import static com.dualedit.expression.ast.Trees.op;
import static com.dualedit.expression.ast.Trees.str;
import static com.dualedit.expression.ast.Trees.sym;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    private IntermediateNode parse(String text) {
        ParseResult<IntermediateNode> result = parser.parse(text);
        assertTrue(result.isSuccess(), () -> "expected success for '" + text + "': " + result.getError());
        return result.getNode();
    }

    private ParseError fail(String text) {
        ParseResult<IntermediateNode> result = parser.parse(text);
        assertFalse(result.isSuccess(), () -> "expected failure for '" + text + "' but got " + result);
        return result.getError();
    }

    @Test
    void parse_multiplicationBindsTighterThanAddition() {
        assertEquals(op(Operator.ADD, num(1), op(Operator.MULTIPLY, num(2), num(3))), parse("1 + 2 * 3"));
    }

    @Test
    void parse_leftAssociativeSubtractionAndRightAssociativePower() {
        assertEquals(op(Operator.SUBTRACT, op(Operator.SUBTRACT, sym("a"), sym("b")), sym("c")), parse("a - b - c"));
        assertEquals(op(Operator.POWER, sym("a"), op(Operator.POWER, sym("b"), sym("c"))), parse("a ^ b ^ c"));
    }

    @Test
    void parse_unaryMinusBindsLooserThanPower() {
        assertEquals(op(Operator.NEGATE, op(Operator.POWER, sym("x"), num(2))), parse("-x ^ 2"));
        assertEquals(op(Operator.POWER, num(2), op(Operator.NEGATE, num(1))), parse("2 ^ -1"));
        assertEquals(sym("x"), parse("+x"));
    }

    @Test
    void parse_logicalOperatorsAndComparisons() {
        assertEquals(op(Operator.OR,
                        op(Operator.AND, op(Operator.NOT, sym("a")), op(Operator.LESS_EQUAL, sym("b"), num(3))),
                        op(Operator.NOT_EQUAL, sym("c"), bool(true))),
                parse("not a and b <= 3 or c != true"));
    }

    @Test
    void parse_conditionalIsRightAssociative() {
        assertEquals(op(Operator.CONDITIONAL, sym("a"), num(1), op(Operator.CONDITIONAL, sym("b"), num(2), num(3))),
                parse("a ? 1 : b ? 2 : 3"));
    }

    @Test
    void parse_keepsUserParenthesesAsGroupings() {
        IntermediateNode node = parse("(1 + 2) * 3");
        assertEquals(op(Operator.MULTIPLY, group(op(Operator.ADD, num(1), num(2))), num(3)), node);
        assertInstanceOf(GroupingNode.class, node.getChildren().get(0));
    }

    @Test
    void parse_functionCallsAndStrings() {
        assertEquals(call("equalText", sym("name"), str("John")), parse("equalText(name, \"John\")"));
        assertEquals(call("max", num(1), num(2.5), num(1500)), parse("max(1, 2.5, 1.5e3)"));
        assertEquals(str("it's \"quoted\""), parse("'it\\'s \"quoted\"'"));
        assertInstanceOf(FunctionCallNode.class, parse("f(g(x))").getChildren().get(0));
    }

    @Test
    void parse_assignsUniqueIds() {
        IntermediateNode node = parse("sin(a) + b * (c - 1)");
        Set<String> ids = new HashSet<>();
        IntermediateNodes.walk(node, n -> assertTrue(ids.add(n.getId()), "duplicate id " + n.getId()));
    }

    @Test
    void parse_booleanLiteralsAreConstants() {
        IntermediateNode node = parse("false");
        assertInstanceOf(ConstantNode.class, node);
        assertEquals(Boolean.FALSE, ((ConstantNode) node).getValue());
    }

    @Test
    void parse_reportsErrorsWithOffsets() {
        assertEquals(4, fail("1 + ").offset());
        assertEquals(2, fail("f()").offset());
        assertTrue(fail("f()").message().contains("at least one argument"));
        assertEquals(2, fail("1 2").offset());
        assertTrue(fail("a = 1").message().contains("=="));
        assertTrue(fail("'open").message().contains("Unterminated"));
        assertTrue(fail("(1 + 2").message().contains("')'"));
        assertTrue(fail("a ? b").message().contains("':'"));
        assertTrue(fail("1 # 2").message().contains("#"));
    }

    @Test
    void parse_emptyOrNullTextFails() {
        fail("");
        fail("   ");
        assertFalse(parser.parse(null).isSuccess());
    }

    @Test
    void parse_excessiveNestingFailsInsteadOfOverflowing() {
        String deep = "(".repeat(5000) + "1" + ")".repeat(5000);
        assertTrue(fail(deep).message().contains("nested too deeply"));
        assertTrue(parser.parse("(".repeat(50) + "1" + ")".repeat(50)).isSuccess());
    }

    @Test
    void parse_longOperatorRunFailsInsteadOfOverflowing() {
        assertTrue(fail("1" + "+1".repeat(5000)).message().contains("nested too deeply"));
        assertTrue(fail("a" + " and a".repeat(5000)).message().contains("nested too deeply"));
        assertTrue(fail("(" + "1" + "-1".repeat(ExpressionParser.MAX_DEPTH) + ")").message().contains("nested too deeply"));
        assertTrue(parser.parse("1" + "+1".repeat(150)).isSuccess());
    }
}
