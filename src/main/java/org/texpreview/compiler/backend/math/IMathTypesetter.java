package org.texpreview.compiler.backend.math;

/**
 * Typesets one math formula. Implementations never throw: a formula that cannot be typeset yields
 * a failed {@link TypesetResult}.
 */
@FunctionalInterface
public interface IMathTypesetter {

    /**
     * Typesets a formula.
     * @param latex The formula source without delimiters.
     * @param display {@code true} for display style, {@code false} for inline text style.
     * @return The typeset image or the failure reason.
     */
    TypesetResult typeset(String latex, boolean display);
}
