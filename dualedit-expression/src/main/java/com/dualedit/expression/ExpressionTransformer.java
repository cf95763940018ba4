package com.dualedit.expression;

import com.dualedit.expression.ast.ExpressionAnalysis;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.IntermediateNodes;
import com.dualedit.expression.text.ExpressionParser;
import com.dualedit.expression.text.ExpressionPrinter;
import com.dualedit.expression.text.GroupingSimplifier;
import com.dualedit.expression.text.ParseResult;
import com.dualedit.expression.validation.ExpressionValidator;
import com.dualedit.expression.validation.ValidationResult;
import com.dualedit.expression.visual.ConversionResult;
import com.dualedit.expression.visual.VisualNode;
import com.dualedit.expression.visual.VisualTreeConverter;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link RepresentationTransformer} for math/logic expressions. Stateless apart from its collaborators,
 * which are themselves stateless, so one instance can serve any number of sessions.
 */
public final class ExpressionTransformer implements RepresentationTransformer<IntermediateNode> {

    private final ExpressionParser parser;
    private final ExpressionPrinter printer;
    private final VisualTreeConverter converter;
    private final ExpressionValidator validator;
    private final GroupingSimplifier simplifier = new GroupingSimplifier();

    public ExpressionTransformer() {
        this(new ExpressionParser(), new ExpressionPrinter(), new VisualTreeConverter(), new ExpressionValidator());
    }

    public ExpressionTransformer(ExpressionValidator validator) {
        this(new ExpressionParser(), new ExpressionPrinter(), new VisualTreeConverter(), validator);
    }

    public ExpressionTransformer(ExpressionParser parser, ExpressionPrinter printer,
                                 VisualTreeConverter converter, ExpressionValidator validator) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.printer = Objects.requireNonNull(printer, "printer");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    @Override
    public ConversionResult<IntermediateNode> visualToIntermediate(VisualNode visual) {
        return converter.toIntermediate(visual);
    }

    @Override
    public VisualNode intermediateToVisual(IntermediateNode intermediate) {
        return converter.toVisual(intermediate);
    }

    @Override
    public String intermediateToText(IntermediateNode intermediate) {
        return printer.print(intermediate);
    }

    @Override
    public ParseResult<IntermediateNode> textToIntermediate(String text) {
        return parser.parse(text);
    }

    @Override
    public ValidationResult validate(IntermediateNode intermediate) {
        return validator.validate(intermediate);
    }

    /** Removes parentheses that do not affect the parse. */
    @Override
    public IntermediateNode format(IntermediateNode intermediate) {
        return simplifier.simplify(intermediate);
    }

    /** Functions called and variables referenced by the tree. */
    public ExpressionAnalysis analyze(IntermediateNode intermediate) {
        return IntermediateNodes.analyze(intermediate);
    }

    /** Same as {@link #analyze(IntermediateNode)} on parsed text; empty when the text does not parse. */
    public Optional<ExpressionAnalysis> analyzeText(String text) {
        return parser.parse(text).node().map(IntermediateNodes::analyze);
    }

    /** Reformats text through the tree; empty when the text does not parse. */
    public Optional<String> formatText(String text) {
        return parser.parse(text).node().map(n -> printer.print(format(n)));
    }
}
