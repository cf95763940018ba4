package com.dualedit.expression;

import com.dualedit.expression.text.ParseResult;
import com.dualedit.expression.validation.ValidationResult;
import com.dualedit.expression.visual.ConversionResult;
import com.dualedit.expression.visual.VisualNode;

/**
 * Conversions between the visual tree, an intermediate tree of type {@code I} and text. Every method is
 * total: malformed input yields a result value (issues, parse error, validation errors), never an exception.
 *
 * @param <I> intermediate representation of this representation family
 */
public interface RepresentationTransformer<I> {

    /** Converts blocks to the intermediate tree; unknown blocks become placeholders listed as issues. */
    ConversionResult<I> visualToIntermediate(VisualNode visual);

    /** Inverse of {@link #visualToIntermediate}; representation-only wrappers are dropped. */
    VisualNode intermediateToVisual(I intermediate);

    /** Text that reparses to an equivalent tree. Empty for null. */
    String intermediateToText(I intermediate);

    ParseResult<I> textToIntermediate(String text);

    ValidationResult validate(I intermediate);

    /** Normalized copy of the tree. */
    I format(I intermediate);
}
