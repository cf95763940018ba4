package com.dualedit.expression.visual;

import com.dualedit.expression.ast.ConstantNode;
import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.GroupingNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.IntermediateNodeVisitor;
import com.dualedit.expression.ast.MathConstant;
import com.dualedit.expression.ast.NodeIdGenerator;
import com.dualedit.expression.ast.Operator;
import com.dualedit.expression.ast.OperatorNode;
import com.dualedit.expression.ast.SymbolNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Converts between visual blocks and the expression tree.
 * <p>
 * Visual to tree keeps block ids as node ids (fresh ids for missing or repeated ones), so a text range
 * mapped to a node id selects the matching block. Problems never abort the conversion: the offending
 * block becomes a placeholder constant ({@code 0}, or {@code false} where a condition is expected) and
 * a {@link ConversionIssue} is reported and logged at warn.
 * <p>
 * Tree to visual drops {@link GroupingNode}s and picks the block kind by operator and arity:
 * one argument {@code math_function}, two {@code math_function_dual} ({@code text_join} for
 * {@code concat}), more {@code function_call}. Symbols named after a {@link MathConstant} become
 * {@code math_constant} blocks.
 */
public final class VisualTreeConverter {

    private static final Logger log = LoggerFactory.getLogger(VisualTreeConverter.class);

    public static final String CONCAT = "concat";

    static final String FIELD_NUM = "NUM";
    static final String FIELD_VAR = "VAR";
    static final String FIELD_CONSTANT = "CONSTANT";
    static final String FIELD_OP = "OP";
    static final String FIELD_FUNC = "FUNC";
    static final String FIELD_BOOL = "BOOL";
    static final String FIELD_TEXT = "TEXT";
    static final String SLOT_A = "A";
    static final String SLOT_B = "B";
    static final String SLOT_NUM = "NUM";
    static final String SLOT_BOOL = "BOOL";
    static final String SLOT_ARG = "ARG";
    static final String SLOT_ARG1 = "ARG1";
    static final String SLOT_ARG2 = "ARG2";
    static final String SLOT_ARGS = "ARGS";
    static final String SLOT_EXPR = "EXPR";
    static final String SLOT_IF = "IF";
    static final String SLOT_THEN = "THEN";
    static final String SLOT_ELSE = "ELSE";

    private static final Map<String, Operator> ARITHMETIC = Map.of(
            "ADD", Operator.ADD,
            "MINUS", Operator.SUBTRACT,
            "MULTIPLY", Operator.MULTIPLY,
            "DIVIDE", Operator.DIVIDE,
            "POWER", Operator.POWER,
            "MODULO", Operator.MODULO);
    private static final Map<String, Operator> COMPARE = Map.of(
            "EQ", Operator.EQUAL,
            "NEQ", Operator.NOT_EQUAL,
            "LT", Operator.LESS,
            "LTE", Operator.LESS_EQUAL,
            "GT", Operator.GREATER,
            "GTE", Operator.GREATER_EQUAL);
    private static final Map<String, Operator> LOGIC = Map.of(
            "AND", Operator.AND,
            "OR", Operator.OR);
    private static final Map<Operator, String> OP_FIELD = new EnumMap<>(Operator.class);

    static {
        ARITHMETIC.forEach((k, v) -> OP_FIELD.put(v, k));
        COMPARE.forEach((k, v) -> OP_FIELD.put(v, k));
        LOGIC.forEach((k, v) -> OP_FIELD.put(v, k));
    }

    private final Supplier<NodeIdGenerator> idGenerators;

    public VisualTreeConverter() {
        this(() -> NodeIdGenerator.sequential("v"));
    }

    public VisualTreeConverter(Supplier<NodeIdGenerator> idGenerators) {
        this.idGenerators = idGenerators;
    }

    public ConversionResult<IntermediateNode> toIntermediate(VisualNode root) {
        if (root == null) {
            return ConversionResult.clean(null);
        }
        Forward forward = new Forward(idGenerators.get());
        IntermediateNode node = forward.convert(root, false, false);
        return new ConversionResult<>(node, forward.issues);
    }

    public VisualNode toVisual(IntermediateNode root) {
        return root == null ? null : root.accept(new Backward());
    }

    private static final class Forward {
        private final NodeIdGenerator ids;
        private final List<ConversionIssue> issues = new ArrayList<>();
        private final Set<String> usedIds = new HashSet<>();

        private Forward(NodeIdGenerator ids) {
            this.ids = ids;
        }

        IntermediateNode convert(VisualNode v, boolean logical, boolean nextConsumed) {
            if (v.getNext() != null && !nextConsumed) {
                issue(v, ConversionIssueCode.IGNORED_NEXT, "Blocks chained after '" + v.getKind() + "' are not part of the expression");
            }
            VisualNodeKind kind = v.getKindType();
            return switch (kind) {
                case MATH_NUMBER -> number(v, logical);
                case MATH_VARIABLE -> variable(v, logical);
                case MATH_CONSTANT -> constant(v, logical);
                case MATH_ARITHMETIC -> binary(v, ARITHMETIC, false, logical);
                case LOGIC_COMPARE -> binary(v, COMPARE, false, logical);
                case LOGIC_OPERATION -> binary(v, LOGIC, true, logical);
                case MATH_NEGATE -> unary(v, Operator.NEGATE, SLOT_NUM, false);
                case LOGIC_NEGATE -> unary(v, Operator.NOT, SLOT_BOOL, true);
                case MATH_FUNCTION -> function(v, logical, SLOT_ARG);
                case MATH_FUNCTION_DUAL -> function(v, logical, SLOT_ARG1, SLOT_ARG2);
                case FUNCTION_CALL -> variadicFunction(v, logical);
                case MATH_PARENTHESES, LOGIC_PARENTHESES -> {
                    String id = idFor(v);
                    yield new GroupingNode(id, slot(v, SLOT_EXPR, kind.isLogical()));
                }
                case LOGIC_BOOLEAN -> bool(v, logical);
                case LOGIC_TERNARY -> {
                    String id = idFor(v);
                    yield new OperatorNode(id, Operator.CONDITIONAL,
                            slot(v, SLOT_IF, true), slot(v, SLOT_THEN, logical), slot(v, SLOT_ELSE, logical));
                }
                case TEXT_STRING -> text(v, logical);
                case TEXT_JOIN -> {
                    String id = idFor(v);
                    yield new FunctionCallNode(id, CONCAT, slot(v, SLOT_A, false), slot(v, SLOT_B, false));
                }
                case UNKNOWN -> placeholder(v, ConversionIssueCode.UNKNOWN_NODE_KIND,
                        "Unknown block kind '" + v.getKind() + "'", logical);
            };
        }

        private IntermediateNode number(VisualNode v, boolean logical) {
            Object raw = v.field(FIELD_NUM);
            Double value = null;
            if (raw instanceof Double) {
                value = (Double) raw;
            } else if (raw instanceof String) {
                try {
                    value = Double.parseDouble(((String) raw).trim());
                } catch (NumberFormatException e) {
                    value = null;
                }
            }
            if (value == null) {
                return placeholder(v, ConversionIssueCode.INVALID_FIELD, "Field NUM is not a number: " + raw, logical);
            }
            return ConstantNode.number(idFor(v), value);
        }

        private IntermediateNode variable(VisualNode v, boolean logical) {
            String name = stringField(v, FIELD_VAR);
            if (name == null || name.isBlank()) {
                return placeholder(v, ConversionIssueCode.INVALID_FIELD, "Field VAR is empty", logical);
            }
            return new SymbolNode(idFor(v), name.trim());
        }

        private IntermediateNode constant(VisualNode v, boolean logical) {
            String name = stringField(v, FIELD_CONSTANT);
            return MathConstant.fromName(name)
                    .<IntermediateNode>map(c -> new SymbolNode(idFor(v), c.symbol()))
                    .orElseGet(() -> placeholder(v, ConversionIssueCode.INVALID_FIELD, "Unknown constant " + name, logical));
        }

        private IntermediateNode binary(VisualNode v, Map<String, Operator> table, boolean logicalOperands, boolean logical) {
            String opName = stringField(v, FIELD_OP);
            Operator op = opName != null ? table.get(opName.trim().toUpperCase(Locale.ROOT)) : null;
            if (op == null) {
                return placeholder(v, ConversionIssueCode.UNKNOWN_OPERATOR,
                        "Unknown operator " + opName + " for " + v.getKind(), logical);
            }
            String id = idFor(v);
            return new OperatorNode(id, op, slot(v, SLOT_A, logicalOperands), slot(v, SLOT_B, logicalOperands));
        }

        private IntermediateNode unary(VisualNode v, Operator op, String slotName, boolean logicalOperand) {
            String id = idFor(v);
            return new OperatorNode(id, op, slot(v, slotName, logicalOperand));
        }

        private IntermediateNode function(VisualNode v, boolean logical, String... slotNames) {
            String name = stringField(v, FIELD_FUNC);
            if (name == null || name.isBlank()) {
                return placeholder(v, ConversionIssueCode.INVALID_FIELD, "Field FUNC is empty", logical);
            }
            String id = idFor(v);
            List<IntermediateNode> args = new ArrayList<>();
            for (String slotName : slotNames) {
                args.add(slot(v, slotName, false));
            }
            return new FunctionCallNode(id, name.trim(), args);
        }

        private IntermediateNode variadicFunction(VisualNode v, boolean logical) {
            String name = stringField(v, FIELD_FUNC);
            if (name == null || name.isBlank()) {
                return placeholder(v, ConversionIssueCode.INVALID_FIELD, "Field FUNC is empty", logical);
            }
            String id = idFor(v);
            List<IntermediateNode> args = new ArrayList<>();
            VisualNode first = v.slot(SLOT_ARGS);
            if (first == null) {
                args.add(missing(v, SLOT_ARGS, false));
            }
            for (VisualNode arg = first; arg != null; arg = arg.getNext()) {
                args.add(convert(arg, false, true));
            }
            return new FunctionCallNode(id, name.trim(), args);
        }

        private IntermediateNode bool(VisualNode v, boolean logical) {
            Object raw = v.field(FIELD_BOOL);
            if (raw instanceof Boolean) {
                return ConstantNode.bool(idFor(v), (Boolean) raw);
            }
            if (raw instanceof String && ("TRUE".equalsIgnoreCase((String) raw) || "FALSE".equalsIgnoreCase((String) raw))) {
                return ConstantNode.bool(idFor(v), "TRUE".equalsIgnoreCase((String) raw));
            }
            return placeholder(v, ConversionIssueCode.INVALID_FIELD, "Field BOOL is not TRUE or FALSE: " + raw, logical);
        }

        private IntermediateNode text(VisualNode v, boolean logical) {
            Object raw = v.field(FIELD_TEXT);
            if (raw == null) {
                return placeholder(v, ConversionIssueCode.INVALID_FIELD, "Field TEXT is missing", logical);
            }
            return ConstantNode.string(idFor(v), raw instanceof Double ? formatField((Double) raw) : raw.toString());
        }

        private IntermediateNode slot(VisualNode parent, String name, boolean logical) {
            VisualNode child = parent.slot(name);
            if (child == null) {
                return missing(parent, name, logical);
            }
            return convert(child, logical, false);
        }

        private IntermediateNode missing(VisualNode parent, String slotName, boolean logical) {
            issue(parent, ConversionIssueCode.MISSING_SLOT, "Slot " + slotName + " of '" + parent.getKind() + "' is empty");
            return neutral(freshId(), logical);
        }

        private IntermediateNode placeholder(VisualNode v, ConversionIssueCode code, String message, boolean logical) {
            issue(v, code, message);
            return neutral(idFor(v), logical);
        }

        private static IntermediateNode neutral(String id, boolean logical) {
            return logical ? ConstantNode.bool(id, false) : ConstantNode.number(id, 0);
        }

        private void issue(VisualNode v, ConversionIssueCode code, String message) {
            log.warn("Visual tree issue {} at {}: {}", code, v.getId(), message);
            issues.add(new ConversionIssue(v.getId(), code, message));
        }

        private String idFor(VisualNode v) {
            String id = v.getId();
            if (id == null || id.isBlank()) {
                return freshId();
            }
            if (!usedIds.add(id)) {
                issue(v, ConversionIssueCode.DUPLICATE_ID, "Block id " + id + " is used more than once");
                return freshId();
            }
            return id;
        }

        private String freshId() {
            String id;
            do {
                id = ids.get();
            } while (!usedIds.add(id));
            return id;
        }

        private static String stringField(VisualNode v, String name) {
            Object raw = v.field(name);
            return raw != null ? raw.toString() : null;
        }

        private static String formatField(Double value) {
            return value == Math.rint(value) && !value.isInfinite() ? Long.toString(value.longValue()) : value.toString();
        }
    }

    private static final class Backward implements IntermediateNodeVisitor<VisualNode> {

        @Override
        public VisualNode visitConstant(ConstantNode node) {
            switch (node.getType()) {
                case STRING:
                    return VisualNode.builder(VisualNodeKind.TEXT_STRING).id(node.getId())
                            .field(FIELD_TEXT, node.getValue()).build();
                case BOOLEAN:
                    return VisualNode.builder(VisualNodeKind.LOGIC_BOOLEAN).id(node.getId())
                            .field(FIELD_BOOL, (Boolean) node.getValue() ? "TRUE" : "FALSE").build();
                default:
                    return VisualNode.builder(VisualNodeKind.MATH_NUMBER).id(node.getId())
                            .field(FIELD_NUM, node.getNumber()).build();
            }
        }

        @Override
        public VisualNode visitSymbol(SymbolNode node) {
            return MathConstant.fromSymbol(node.getName())
                    .map(c -> VisualNode.builder(VisualNodeKind.MATH_CONSTANT).id(node.getId())
                            .field(FIELD_CONSTANT, c.name()).build())
                    .orElseGet(() -> VisualNode.builder(VisualNodeKind.MATH_VARIABLE).id(node.getId())
                            .field(FIELD_VAR, node.getName()).build());
        }

        @Override
        public VisualNode visitGrouping(GroupingNode node) {
            return node.getContent().accept(this);
        }

        @Override
        public VisualNode visitFunctionCall(FunctionCallNode node) {
            List<IntermediateNode> args = node.getArguments();
            if (CONCAT.equals(node.getName()) && args.size() == 2) {
                return VisualNode.builder(VisualNodeKind.TEXT_JOIN).id(node.getId())
                        .slot(SLOT_A, args.get(0).accept(this))
                        .slot(SLOT_B, args.get(1).accept(this)).build();
            }
            if (args.size() == 1) {
                return VisualNode.builder(VisualNodeKind.MATH_FUNCTION).id(node.getId())
                        .field(FIELD_FUNC, node.getName())
                        .slot(SLOT_ARG, args.get(0).accept(this)).build();
            }
            if (args.size() == 2) {
                return VisualNode.builder(VisualNodeKind.MATH_FUNCTION_DUAL).id(node.getId())
                        .field(FIELD_FUNC, node.getName())
                        .slot(SLOT_ARG1, args.get(0).accept(this))
                        .slot(SLOT_ARG2, args.get(1).accept(this)).build();
            }
            VisualNode chain = null;
            for (int i = args.size() - 1; i >= 0; i--) {
                chain = args.get(i).accept(this).withNext(chain);
            }
            return VisualNode.builder(VisualNodeKind.FUNCTION_CALL).id(node.getId())
                    .field(FIELD_FUNC, node.getName())
                    .slot(SLOT_ARGS, chain).build();
        }

        @Override
        public VisualNode visitOperator(OperatorNode node) {
            Operator op = node.getOperator();
            switch (op) {
                case NEGATE:
                    return VisualNode.builder(VisualNodeKind.MATH_NEGATE).id(node.getId())
                            .slot(SLOT_NUM, node.getOperand(0).accept(this)).build();
                case NOT:
                    return VisualNode.builder(VisualNodeKind.LOGIC_NEGATE).id(node.getId())
                            .slot(SLOT_BOOL, node.getOperand(0).accept(this)).build();
                case CONDITIONAL:
                    return VisualNode.builder(VisualNodeKind.LOGIC_TERNARY).id(node.getId())
                            .slot(SLOT_IF, node.getOperand(0).accept(this))
                            .slot(SLOT_THEN, node.getOperand(1).accept(this))
                            .slot(SLOT_ELSE, node.getOperand(2).accept(this)).build();
                default:
                    VisualNodeKind kind = ARITHMETIC.containsValue(op) ? VisualNodeKind.MATH_ARITHMETIC
                            : COMPARE.containsValue(op) ? VisualNodeKind.LOGIC_COMPARE
                            : VisualNodeKind.LOGIC_OPERATION;
                    return VisualNode.builder(kind).id(node.getId())
                            .field(FIELD_OP, OP_FIELD.get(op))
                            .slot(SLOT_A, node.getOperand(0).accept(this))
                            .slot(SLOT_B, node.getOperand(1).accept(this)).build();
            }
        }
    }
}
