package com.dualedit.expression.text;

import com.dualedit.expression.ast.ConstantNode;
import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.GroupingNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.NodeIdGenerator;
import com.dualedit.expression.ast.Operator;
import com.dualedit.expression.ast.OperatorNode;
import com.dualedit.expression.ast.SymbolNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Precedence-climbing parser for expression text.
 * <pre>
 * conditional := binary ('?' conditional ':' conditional)?
 * binary      := unary (binop binary)*         -- or, and, relational, additive, multiplicative
 * unary       := ('-' | '+' | 'not') unary | power
 * power       := primary ('^' unary)?
 * primary     := number | string | boolean | identifier | identifier '(' args ')' | '(' conditional ')'
 * </pre>
 * Every pair of parentheses that is not a call becomes a {@link GroupingNode}. Unary plus is dropped.
 * {@link #parse(String)} never throws.
 */
public final class ExpressionParser {

    /**
     * Maximum tree depth: nesting of parentheses, calls, conditionals and unary operators, plus the length
     * of each run of left-associative binary operators.
     */
    public static final int MAX_DEPTH = 200;

    private final ExpressionLexer lexer = new ExpressionLexer();
    private final Supplier<NodeIdGenerator> idGenerators;

    public ExpressionParser() {
        this(() -> NodeIdGenerator.sequential("t"));
    }

    /** @param idGenerators called once per {@link #parse} so each tree gets its own id sequence */
    public ExpressionParser(Supplier<NodeIdGenerator> idGenerators) {
        this.idGenerators = idGenerators;
    }

    public ParseResult<IntermediateNode> parse(String text) {
        if (text == null) {
            return ParseResult.failure("Expression text is null", 0);
        }
        if (text.isBlank()) {
            return ParseResult.failure("Expression is empty", 0);
        }
        try {
            Run run = new Run(lexer.tokenize(text), idGenerators.get());
            IntermediateNode root = run.conditional(0);
            Token trailing = run.peek();
            if (!trailing.is(TokenType.EOF)) {
                throw run.unexpected(trailing);
            }
            return ParseResult.success(root);
        } catch (SyntaxException e) {
            return ParseResult.failure(e.getMessage(), e.offset);
        }
    }

    private static final class Run {
        private final List<Token> tokens;
        private final NodeIdGenerator ids;
        private int pos;

        private Run(List<Token> tokens, NodeIdGenerator ids) {
            this.tokens = tokens;
            this.ids = ids;
        }

        IntermediateNode conditional(int depth) {
            checkDepth(depth);
            IntermediateNode condition = binary(Operator.OR.order().level(), depth);
            if (!peek().is(TokenType.QUESTION)) {
                return condition;
            }
            advance();
            IntermediateNode whenTrue = conditional(depth + 1);
            expect(TokenType.COLON, "':' in conditional expression");
            IntermediateNode whenFalse = conditional(depth + 1);
            return new OperatorNode(ids.get(), Operator.CONDITIONAL, condition, whenTrue, whenFalse);
        }

        IntermediateNode binary(int maxLevel, int depth) {
            IntermediateNode left = unary(depth);
            int chained = 0;
            while (true) {
                Optional<Operator> op = binaryOperator(peek());
                if (op.isEmpty() || op.get().order().level() > maxLevel) {
                    return left;
                }
                // each operator in the run pushes the leftmost operand one level deeper
                chained++;
                checkDepth(depth + chained);
                advance();
                IntermediateNode right = binary(op.get().order().level() - 1, depth + chained);
                left = new OperatorNode(ids.get(), op.get(), left, right);
            }
        }

        IntermediateNode unary(int depth) {
            checkDepth(depth);
            Token t = peek();
            if (t.is(TokenType.OPERATOR, "-")) {
                advance();
                return new OperatorNode(ids.get(), Operator.NEGATE, unary(depth + 1));
            }
            if (t.is(TokenType.OPERATOR, "+")) {
                advance();
                return unary(depth + 1);
            }
            if (t.is(TokenType.KEYWORD, "not")) {
                advance();
                return new OperatorNode(ids.get(), Operator.NOT, unary(depth + 1));
            }
            return power(depth);
        }

        IntermediateNode power(int depth) {
            IntermediateNode base = primary(depth);
            if (!peek().is(TokenType.OPERATOR, "^")) {
                return base;
            }
            advance();
            IntermediateNode exponent = unary(depth + 1);
            return new OperatorNode(ids.get(), Operator.POWER, base, exponent);
        }

        IntermediateNode primary(int depth) {
            Token t = peek();
            switch (t.type()) {
                case NUMBER:
                    advance();
                    return ConstantNode.number(ids.get(), (Double) t.value());
                case STRING:
                    advance();
                    return ConstantNode.string(ids.get(), (String) t.value());
                case BOOLEAN:
                    advance();
                    return ConstantNode.bool(ids.get(), (Boolean) t.value());
                case IDENTIFIER:
                    advance();
                    if (peek().is(TokenType.LPAREN)) {
                        return call(t, depth);
                    }
                    return new SymbolNode(ids.get(), t.text());
                case LPAREN:
                    advance();
                    String groupId = ids.get();
                    IntermediateNode content = conditional(depth + 1);
                    expect(TokenType.RPAREN, "')'");
                    return new GroupingNode(groupId, content);
                default:
                    throw unexpected(t);
            }
        }

        private IntermediateNode call(Token name, int depth) {
            String callId = ids.get();
            advance();
            if (peek().is(TokenType.RPAREN)) {
                throw new SyntaxException("Function '" + name.text() + "' needs at least one argument", peek().start());
            }
            List<IntermediateNode> args = new ArrayList<>();
            args.add(conditional(depth + 1));
            while (peek().is(TokenType.COMMA)) {
                advance();
                args.add(conditional(depth + 1));
            }
            expect(TokenType.RPAREN, "')' after arguments of '" + name.text() + "'");
            return new FunctionCallNode(callId, name.text(), args);
        }

        private static Optional<Operator> binaryOperator(Token t) {
            if (t.is(TokenType.OPERATOR) || t.is(TokenType.KEYWORD)) {
                return Operator.binary(t.text()).filter(op -> op != Operator.POWER);
            }
            return Optional.empty();
        }

        Token peek() {
            return tokens.get(pos);
        }

        private void advance() {
            if (pos < tokens.size() - 1) {
                pos++;
            }
        }

        private void expect(TokenType type, String what) {
            Token t = peek();
            if (!t.is(type)) {
                if (t.is(TokenType.ERROR)) {
                    throw unexpected(t);
                }
                throw new SyntaxException("Expected " + what + (t.is(TokenType.EOF) ? " but reached end of expression" : " but found '" + t.text() + "'"), t.start());
            }
            advance();
        }

        SyntaxException unexpected(Token t) {
            if (t.is(TokenType.ERROR)) {
                return new SyntaxException(t.error(), t.start());
            }
            if (t.is(TokenType.EOF)) {
                return new SyntaxException("Unexpected end of expression", t.start());
            }
            return new SyntaxException("Unexpected token '" + t.text() + "'", t.start());
        }

        private void checkDepth(int depth) {
            if (depth > MAX_DEPTH) {
                throw new SyntaxException("Expression is nested too deeply", peek().start());
            }
        }
    }

    private static final class SyntaxException extends RuntimeException {
        private final int offset;

        SyntaxException(String message, int offset) {
            super(message, null, false, false);
            this.offset = offset;
        }
    }
}
