package com.dualedit.expression.validation;

import com.dualedit.expression.ast.ConstantNode;
import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.GroupingNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.IntermediateNodeVisitor;
import com.dualedit.expression.ast.MathConstant;
import com.dualedit.expression.ast.Operator;
import com.dualedit.expression.ast.OperatorNode;
import com.dualedit.expression.ast.SymbolNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Small evaluator used to check that an expression is well typed. Numbers are doubles (division by zero gives
 * Infinity), booleans count as 0/1 in arithmetic, numeric strings convert to numbers. Equality and ordering
 * compare text when both sides are strings.
 */
public final class ExpressionEvaluator {

    private final FunctionCatalog functions;

    public ExpressionEvaluator(FunctionCatalog functions) {
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    /**
     * @param variables resolves free variables; returning null means the variable is undefined
     * @return a {@link Double}, {@link String} or {@link Boolean}
     * @throws EvaluationException if the expression does not evaluate
     */
    public Object evaluate(IntermediateNode node, Function<String, Object> variables) {
        return node.accept(new Evaluation(variables));
    }

    private final class Evaluation implements IntermediateNodeVisitor<Object> {
        private final Function<String, Object> variables;

        private Evaluation(Function<String, Object> variables) {
            this.variables = variables;
        }

        @Override
        public Object visitConstant(ConstantNode node) {
            return node.getValue();
        }

        @Override
        public Object visitSymbol(SymbolNode node) {
            Optional<MathConstant> constant = MathConstant.fromSymbol(node.getName());
            if (constant.isPresent()) {
                return constant.get().value();
            }
            Object value = variables.apply(node.getName());
            if (value == null) {
                throw new EvaluationException("Undefined symbol " + node.getName());
            }
            return value;
        }

        @Override
        public Object visitGrouping(GroupingNode node) {
            return node.getContent().accept(this);
        }

        @Override
        public Object visitFunctionCall(FunctionCallNode node) {
            FunctionDefinition f = functions.find(node.getName())
                    .orElseThrow(() -> new EvaluationException("Undefined function " + node.getName()));
            if (!f.accepts(node.getArguments().size())) {
                throw new EvaluationException("Function " + f.name() + " expects " + f.describeArity()
                        + " arguments, got " + node.getArguments().size());
            }
            List<Object> args = new ArrayList<>(node.getArguments().size());
            for (IntermediateNode arg : node.getArguments()) {
                args.add(arg.accept(this));
            }
            return f.body().apply(args);
        }

        @Override
        public Object visitOperator(OperatorNode node) {
            Operator op = node.getOperator();
            String where = "'" + op.symbol() + "'";
            if (op == Operator.CONDITIONAL) {
                boolean condition = Values.toBoolean(node.getOperand(0).accept(this), where);
                return node.getOperand(condition ? 1 : 2).accept(this);
            }
            if (op == Operator.AND) {
                return Values.toBoolean(node.getOperand(0).accept(this), where)
                        && Values.toBoolean(node.getOperand(1).accept(this), where);
            }
            if (op == Operator.OR) {
                return Values.toBoolean(node.getOperand(0).accept(this), where)
                        || Values.toBoolean(node.getOperand(1).accept(this), where);
            }
            Object a = node.getOperand(0).accept(this);
            switch (op) {
                case NEGATE:
                    return -Values.toNumber(a, where);
                case NOT:
                    return !Values.toBoolean(a, where);
                default:
                    break;
            }
            Object b = node.getOperand(1).accept(this);
            switch (op) {
                case EQUAL:
                    return equal(a, b, where);
                case NOT_EQUAL:
                    return !equal(a, b, where);
                case LESS:
                    return compare(a, b, where) < 0;
                case LESS_EQUAL:
                    return compare(a, b, where) <= 0;
                case GREATER:
                    return compare(a, b, where) > 0;
                case GREATER_EQUAL:
                    return compare(a, b, where) >= 0;
                default:
                    return arithmetic(op, Values.toNumber(a, where), Values.toNumber(b, where));
            }
        }

        private boolean equal(Object a, Object b, String where) {
            if (a instanceof String && b instanceof String) {
                return a.equals(b);
            }
            return Values.toNumber(a, where) == Values.toNumber(b, where);
        }

        private int compare(Object a, Object b, String where) {
            if (a instanceof String && b instanceof String) {
                return ((String) a).compareTo((String) b);
            }
            return Double.compare(Values.toNumber(a, where), Values.toNumber(b, where));
        }

        private double arithmetic(Operator op, double a, double b) {
            switch (op) {
                case ADD:
                    return a + b;
                case SUBTRACT:
                    return a - b;
                case MULTIPLY:
                    return a * b;
                case DIVIDE:
                    return a / b;
                case MODULO:
                    return a % b;
                case POWER:
                    return Math.pow(a, b);
                default:
                    throw new EvaluationException("Unsupported operator " + op);
            }
        }
    }
}
