package com.dualedit.expression.ast;

import java.util.List;
import java.util.Objects;

/** Call of a named function with at least one argument. */
public final class FunctionCallNode extends IntermediateNode {

    private final String name;
    private final List<IntermediateNode> arguments;

    public FunctionCallNode(String id, String name, List<IntermediateNode> arguments) {
        super(id);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name is required");
        }
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("Function " + name + " needs at least one argument");
        }
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public FunctionCallNode(String id, String name, IntermediateNode... arguments) {
        this(id, name, List.of(arguments));
    }

    public String getName() {
        return name;
    }

    public List<IntermediateNode> getArguments() {
        return arguments;
    }

    @Override
    public List<IntermediateNode> getChildren() {
        return arguments;
    }

    @Override
    public <R> R accept(IntermediateNodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionCallNode)) return false;
        FunctionCallNode that = (FunctionCallNode) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return "FunctionCall(" + name + ", " + arguments + ")";
    }
}
