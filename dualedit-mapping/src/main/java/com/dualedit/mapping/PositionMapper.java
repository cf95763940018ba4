package com.dualedit.mapping;

import com.dualedit.expression.ast.ConstantNode;
import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.GroupingNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.Operator;
import com.dualedit.expression.ast.OperatorNode;
import com.dualedit.expression.ast.SymbolNode;
import com.dualedit.expression.text.ExpressionLexer;
import com.dualedit.expression.text.ExpressionPrinter;
import com.dualedit.expression.text.Token;
import com.dualedit.expression.text.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Assigns every node of an expression tree its range in the text the tree was printed from or parsed from.
 * <p>
 * The text is scanned once, left to right. Each node is located starting at the end of the previous sibling,
 * so repeated sub-expressions resolve in source order, and the search never leaves the enclosing
 * parentheses. A composite node spans its own tokens and all of its children: a binary operator runs from
 * the start of its left operand to the end of its right one, a call from its name to its closing
 * parenthesis, a grouping from {@code (} to {@code )}. A node whose token cannot be found (hand-edited or
 * corrupt text) gets an empty range at the current cursor, so mapping always completes.
 */
public final class PositionMapper {

    private static final Logger log = LoggerFactory.getLogger(PositionMapper.class);

    private final ExpressionLexer lexer = new ExpressionLexer();

    public Mapping createMapping(IntermediateNode root, String text) {
        if (root == null || text == null) {
            return Mapping.empty();
        }
        Scan scan = new Scan(text, lexer.tokenize(text));
        scan.map(root, 0, scan.eofIndex(), null, 0);
        if (scan.unresolved > 0) {
            log.debug("Mapped {} node(s), {} without a matching token", scan.positions.size(), scan.unresolved);
        }
        return new Mapping(text, scan.positions, scan.parents, scan.depths);
    }

    /** Full rebuild; ranges are never patched incrementally. */
    public Mapping updateMapping(IntermediateNode root, String text) {
        return createMapping(root, text);
    }

    /**
     * Innermost node covering {@code offset}: the smallest non-empty range with {@code start <= offset < end},
     * the deeper node on equal size.
     */
    public Optional<String> findElementByPosition(int offset, Mapping mapping) {
        String best = null;
        Position bestRange = null;
        for (Map.Entry<String, Position> e : mapping.getPositions().entrySet()) {
            Position range = e.getValue();
            if (!range.contains(offset)) continue;
            if (bestRange == null || range.length() < bestRange.length()
                    || (range.length() == bestRange.length() && mapping.depthOf(e.getKey()) > mapping.depthOf(best))) {
                best = e.getKey();
                bestRange = range;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<Position> findPositionByElement(String nodeId, Mapping mapping) {
        return mapping.positionOf(nodeId);
    }

    /**
     * Outermost nodes whose range lies inside {@code selection}, in source order. Empty ranges are skipped.
     */
    public List<String> findElementsInRange(Position selection, Mapping mapping) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, Position> e : mapping.getPositions().entrySet()) {
            Position range = e.getValue();
            if (range.isEmpty() || !selection.contains(range)) continue;
            boolean ancestorSelected = false;
            for (Optional<String> p = mapping.parentOf(e.getKey()); p.isPresent(); p = mapping.parentOf(p.get())) {
                if (result.contains(p.get())) {
                    ancestorSelected = true;
                    break;
                }
            }
            if (!ancestorSelected) {
                result.add(e.getKey());
            }
        }
        return result;
    }

    /** Range of a node and where scanning continues; {@code next} is a token index. */
    private record Step(Position range, int next) {
    }

    private static final class Scan {
        private final String text;
        private final List<Token> tokens;
        private final Map<String, Position> positions = new LinkedHashMap<>();
        private final Map<String, String> parents = new LinkedHashMap<>();
        private final Map<String, Integer> depths = new LinkedHashMap<>();
        private int unresolved;

        private Scan(String text, List<Token> tokens) {
            this.text = text;
            this.tokens = tokens;
        }

        int eofIndex() {
            return tokens.size() - 1;
        }

        Step map(IntermediateNode node, int from, int limit, String parentId, int depth) {
            // reserve the pre-order slot before the children are added
            positions.put(node.getId(), Position.empty(offsetOf(from)));
            if (parentId != null) {
                parents.put(node.getId(), parentId);
            }
            depths.put(node.getId(), depth);

            Step step;
            if (node instanceof ConstantNode) {
                step = constant((ConstantNode) node, from, limit);
            } else if (node instanceof SymbolNode) {
                String name = ((SymbolNode) node).getName();
                step = single(from, limit, t -> t.is(TokenType.IDENTIFIER, name));
            } else if (node instanceof GroupingNode) {
                step = grouping((GroupingNode) node, from, limit, depth);
            } else if (node instanceof FunctionCallNode) {
                step = call((FunctionCallNode) node, from, limit, depth);
            } else {
                step = operator((OperatorNode) node, from, limit, depth);
            }
            positions.put(node.getId(), step.range);
            return step;
        }

        private Step constant(ConstantNode node, int from, int limit) {
            switch (node.getType()) {
                case STRING:
                    return single(from, limit, t -> t.is(TokenType.STRING) && node.getValue().equals(t.value()));
                case BOOLEAN:
                    return single(from, limit, t -> t.is(TokenType.BOOLEAN) && node.getValue().equals(t.value()));
                default:
                    double value = node.getNumber();
                    String printed = ExpressionPrinter.formatNumber(value);
                    if (value < 0 || printed.startsWith("-")) {
                        return negativeNumber(-value, from, limit);
                    }
                    return single(from, limit, t -> matchesNumber(t, value, printed));
            }
        }

        private static boolean matchesNumber(Token t, double value, String printed) {
            if (t.is(TokenType.NUMBER)) {
                return t.value() instanceof Double && Double.compare((Double) t.value(), value) == 0;
            }
            // NaN prints as an identifier
            return t.is(TokenType.IDENTIFIER, printed);
        }

        private Step negativeNumber(double magnitude, int from, int limit) {
            String printed = ExpressionPrinter.formatNumber(magnitude);
            for (int i = from; i + 1 < limit; i++) {
                if (tokens.get(i).is(TokenType.OPERATOR, "-") && matchesNumber(tokens.get(i + 1), magnitude, printed)) {
                    return new Step(new Position(tokens.get(i).start(), tokens.get(i + 1).end()), i + 2);
                }
            }
            return unresolved(from);
        }

        private Step single(int from, int limit, Predicate<Token> match) {
            int i = find(from, limit, match);
            if (i < 0) {
                return unresolved(from);
            }
            Token t = tokens.get(i);
            return new Step(new Position(t.start(), t.end()), i + 1);
        }

        private Step grouping(GroupingNode node, int from, int limit, int depth) {
            int open = find(from, limit, t -> t.is(TokenType.LPAREN));
            if (open < 0) {
                return map(node.getContent(), from, limit, node.getId(), depth + 1);
            }
            int close = matchingParen(open, limit);
            Step content = map(node.getContent(), open + 1, close >= 0 ? close : limit, node.getId(), depth + 1);
            Position range = spanOf(open).union(content.range);
            if (close < 0) {
                return new Step(range, content.next);
            }
            return new Step(range.union(spanOf(close)), close + 1);
        }

        private Step call(FunctionCallNode node, int from, int limit, int depth) {
            int name = -1;
            for (int i = from; i + 1 < limit; i++) {
                if (tokens.get(i).is(TokenType.IDENTIFIER, node.getName()) && tokens.get(i + 1).is(TokenType.LPAREN)) {
                    name = i;
                    break;
                }
            }
            if (name < 0) {
                unresolved++;
            }
            int close = name >= 0 ? matchingParen(name + 1, limit) : -1;
            int argLimit = close >= 0 ? close : limit;
            int cursor = name >= 0 ? name + 2 : from;
            Position range = name >= 0 ? spanOf(name) : null;
            List<IntermediateNode> args = node.getArguments();
            for (int k = 0; k < args.size(); k++) {
                Step arg = map(args.get(k), cursor, argLimit, node.getId(), depth + 1);
                range = range == null ? arg.range : range.union(arg.range);
                cursor = arg.next;
                if (k < args.size() - 1) {
                    int comma = find(cursor, argLimit, t -> t.is(TokenType.COMMA));
                    if (comma >= 0) {
                        cursor = comma + 1;
                    }
                }
            }
            if (close >= 0) {
                return new Step(range.union(spanOf(close)), close + 1);
            }
            return new Step(range, cursor);
        }

        private Step operator(OperatorNode node, int from, int limit, int depth) {
            Operator op = node.getOperator();
            if (op.isUnary()) {
                int at = find(from, limit, t -> isOperatorToken(t, op.symbol()));
                if (at < 0) {
                    unresolved++;
                }
                Step operand = map(node.getOperand(0), at >= 0 ? at + 1 : from, limit, node.getId(), depth + 1);
                Position range = at >= 0 ? spanOf(at).union(operand.range) : operand.range;
                return new Step(range, operand.next);
            }
            List<String> separators = op == Operator.CONDITIONAL ? List.of("?", ":") : List.of(op.symbol());
            int cursor = from;
            Position range = null;
            for (int k = 0; k < op.arity(); k++) {
                Step operand = map(node.getOperand(k), cursor, limit, node.getId(), depth + 1);
                range = range == null ? operand.range : range.union(operand.range);
                cursor = operand.next;
                if (k < op.arity() - 1) {
                    String symbol = separators.get(k);
                    int at = find(cursor, limit, t -> isOperatorToken(t, symbol));
                    if (at >= 0) {
                        cursor = at + 1;
                    } else {
                        unresolved++;
                    }
                }
            }
            return new Step(range, cursor);
        }

        private static boolean isOperatorToken(Token t, String symbol) {
            switch (t.type()) {
                case OPERATOR:
                case KEYWORD:
                case QUESTION:
                case COLON:
                    return t.text().equals(symbol);
                default:
                    return false;
            }
        }

        /** First index in {@code [from, limit)} matching, or -1. Nested parentheses are not skipped. */
        private int find(int from, int limit, Predicate<Token> match) {
            for (int i = from; i < limit; i++) {
                if (match.test(tokens.get(i))) return i;
            }
            return -1;
        }

        private int matchingParen(int open, int limit) {
            int depth = 0;
            for (int i = open; i < limit; i++) {
                Token t = tokens.get(i);
                if (t.is(TokenType.LPAREN)) {
                    depth++;
                } else if (t.is(TokenType.RPAREN) && --depth == 0) {
                    return i;
                }
            }
            return -1;
        }

        private Step unresolved(int from) {
            unresolved++;
            return new Step(Position.empty(offsetOf(from)), from);
        }

        private Position spanOf(int index) {
            Token t = tokens.get(index);
            return new Position(t.start(), t.end());
        }

        private int offsetOf(int index) {
            return index < tokens.size() ? tokens.get(index).start() : text.length();
        }
    }
}
