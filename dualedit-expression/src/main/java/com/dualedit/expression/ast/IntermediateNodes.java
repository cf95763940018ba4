package com.dualedit.expression.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/** Tree utilities over {@link IntermediateNode}. */
public final class IntermediateNodes {

    private IntermediateNodes() {
    }

    /** Pre-order walk. */
    public static void walk(IntermediateNode root, Consumer<IntermediateNode> action) {
        if (root == null) return;
        action.accept(root);
        for (IntermediateNode child : root.getChildren()) {
            walk(child, action);
        }
    }

    public static int count(IntermediateNode root) {
        int[] n = {0};
        walk(root, node -> n[0]++);
        return n[0];
    }

    /** Pre-order list of all nodes. */
    public static List<IntermediateNode> flatten(IntermediateNode root) {
        List<IntermediateNode> nodes = new ArrayList<>();
        walk(root, nodes::add);
        return nodes;
    }

    /** Copy of the tree without any {@link GroupingNode}; other node ids are kept. */
    public static IntermediateNode stripGroupings(IntermediateNode root) {
        if (root == null) return null;
        return root.accept(new IntermediateNodeVisitor<IntermediateNode>() {
            @Override
            public IntermediateNode visitConstant(ConstantNode node) {
                return node;
            }

            @Override
            public IntermediateNode visitSymbol(SymbolNode node) {
                return node;
            }

            @Override
            public IntermediateNode visitOperator(OperatorNode node) {
                return new OperatorNode(node.getId(), node.getOperator(), map(node.getOperands(), this));
            }

            @Override
            public IntermediateNode visitFunctionCall(FunctionCallNode node) {
                return new FunctionCallNode(node.getId(), node.getName(), map(node.getArguments(), this));
            }

            @Override
            public IntermediateNode visitGrouping(GroupingNode node) {
                return node.getContent().accept(this);
            }
        });
    }

    /** Structural equality after removing groupings on both sides. */
    public static boolean equivalent(IntermediateNode a, IntermediateNode b) {
        if (a == null || b == null) return a == b;
        return stripGroupings(a).equals(stripGroupings(b));
    }

    public static ExpressionAnalysis analyze(IntermediateNode root) {
        Set<String> functions = new LinkedHashSet<>();
        Set<String> variables = new LinkedHashSet<>();
        walk(root, node -> {
            if (node instanceof FunctionCallNode) {
                functions.add(((FunctionCallNode) node).getName());
            } else if (node instanceof SymbolNode) {
                SymbolNode symbol = (SymbolNode) node;
                if (!symbol.isReservedConstant()) {
                    variables.add(symbol.getName());
                }
            }
        });
        return new ExpressionAnalysis(functions, variables);
    }

    static List<IntermediateNode> map(List<IntermediateNode> nodes, IntermediateNodeVisitor<IntermediateNode> visitor) {
        List<IntermediateNode> out = new ArrayList<>(nodes.size());
        for (IntermediateNode n : nodes) {
            out.add(n.accept(visitor));
        }
        return out;
    }
}
