package com.dualedit.expression.ast;

/** One method per node variant; adding a variant breaks every visitor at compile time. */
public interface IntermediateNodeVisitor<R> {

    R visitConstant(ConstantNode node);

    R visitSymbol(SymbolNode node);

    R visitOperator(OperatorNode node);

    R visitFunctionCall(FunctionCallNode node);

    R visitGrouping(GroupingNode node);
}
