package com.dualedit.expression.validation;

import com.dualedit.expression.ast.FunctionCallNode;
import com.dualedit.expression.ast.IntermediateNode;
import com.dualedit.expression.ast.IntermediateNodes;
import com.dualedit.expression.ast.SymbolNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Semantic checks on a structurally complete tree: every called function exists with a matching argument
 * count, every variable name can be written as text, and the expression evaluates under at least one
 * variable binding (the {@link VariableTypeHint} guess first, then all numbers, then all strings).
 */
public final class ExpressionValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Set<String> RESERVED_WORDS = Set.of("and", "or", "not", "true", "false");

    private final FunctionCatalog functions;
    private final VariableTypeHint typeHint;
    private final ExpressionEvaluator evaluator;

    public ExpressionValidator() {
        this(FunctionCatalog.defaults(), new NameHeuristicTypeHint());
    }

    public ExpressionValidator(FunctionCatalog functions, VariableTypeHint typeHint) {
        this.functions = Objects.requireNonNull(functions, "functions");
        this.typeHint = Objects.requireNonNull(typeHint, "typeHint");
        this.evaluator = new ExpressionEvaluator(functions);
    }

    public ValidationResult validate(IntermediateNode root) {
        if (root == null) {
            return ValidationResult.failure("Expression is empty");
        }
        List<String> errors = new ArrayList<>();
        IntermediateNodes.walk(root, node -> {
            if (node instanceof FunctionCallNode) {
                checkCall((FunctionCallNode) node, errors);
            } else if (node instanceof SymbolNode) {
                String name = ((SymbolNode) node).getName();
                if (!IDENTIFIER.matcher(name).matches() || RESERVED_WORDS.contains(name)) {
                    errors.add("Invalid variable name '" + name + "'");
                }
            }
        });
        if (!errors.isEmpty()) {
            return ValidationResult.failure(errors);
        }
        return evaluate(root);
    }

    private void checkCall(FunctionCallNode call, List<String> errors) {
        functions.find(call.getName()).ifPresentOrElse(
                f -> {
                    if (!f.accepts(call.getArguments().size())) {
                        errors.add("Function '" + f.name() + "' expects " + f.describeArity()
                                + " argument(s), got " + call.getArguments().size());
                    }
                },
                () -> errors.add("Unknown function '" + call.getName() + "'"));
    }

    private ValidationResult evaluate(IntermediateNode root) {
        Set<VariableTypeHint> attempts = new LinkedHashSet<>(List.of(typeHint, FixedTypeHint.ALL_NUMBERS, FixedTypeHint.ALL_STRINGS));
        String firstFailure = null;
        for (VariableTypeHint hint : attempts) {
            try {
                evaluator.evaluate(root, name -> hint.typeOf(name).sampleFor(name));
                return ValidationResult.success();
            } catch (EvaluationException e) {
                if (firstFailure == null) {
                    firstFailure = e.getMessage();
                }
            }
        }
        return ValidationResult.failure("Expression does not evaluate: " + firstFailure);
    }
}
