package com.dualedit.expression.text;

import com.dualedit.expression.ast.ConstantNode;
import com.dualedit.expression.ast.ConstantType;
import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.GroupingNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.OperatorNode;
import com.dualedit.expression.ast.Order;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes groupings whose parentheses do not change how the text parses, keeping the ones that do.
 * {@code ((a)) + (b * c)} becomes {@code a + b * c}; {@code (a + b) * c} is left alone.
 */
public final class GroupingSimplifier {

    public IntermediateNode simplify(IntermediateNode root) {
        return root == null ? null : simplify(root, Order.NONE);
    }

    private IntermediateNode simplify(IntermediateNode node, Order context) {
        if (node instanceof GroupingNode) {
            IntermediateNode content = simplify(((GroupingNode) node).getContent(), Order.NONE);
            return orderOf(content).needsParenthesesIn(context) ? new GroupingNode(node.getId(), content) : content;
        }
        if (node instanceof OperatorNode) {
            OperatorNode op = (OperatorNode) node;
            List<IntermediateNode> operands = new ArrayList<>();
            for (int i = 0; i < op.getOperands().size(); i++) {
                operands.add(simplify(op.getOperand(i), op.getOperator().operandContext(i)));
            }
            return new OperatorNode(op.getId(), op.getOperator(), operands);
        }
        if (node instanceof FunctionCallNode) {
            FunctionCallNode call = (FunctionCallNode) node;
            List<IntermediateNode> args = new ArrayList<>();
            for (IntermediateNode arg : call.getArguments()) {
                args.add(simplify(arg, Order.NONE));
            }
            return new FunctionCallNode(call.getId(), call.getName(), args);
        }
        return node;
    }

    /** Order the printer assigns to {@code node} when it is rendered without extra parentheses. */
    public static Order orderOf(IntermediateNode node) {
        if (node instanceof OperatorNode) {
            return ((OperatorNode) node).getOperator().order();
        }
        if (node instanceof FunctionCallNode) {
            return Order.FUNCTION_CALL;
        }
        if (node instanceof ConstantNode) {
            ConstantNode c = (ConstantNode) node;
            if (c.getType() == ConstantType.NUMBER && ExpressionPrinter.formatNumber(c.getNumber()).startsWith("-")) {
                return Order.UNARY;
            }
        }
        return Order.ATOMIC;
    }
}
