package org.texpreview.compiler.backend.math;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises JLaTeXMath itself; runs headless.
 */
public class JLatexMathTypesetterTest {

    private final JLatexMathTypesetter typesetter = new JLatexMathTypesetter(18f);

    @Test
    @Tag("integration")
    void rendersFormulaAsPngDataUri() {
        TypesetResult result = typesetter.typeset("x^2 + \\frac{a}{b}", false);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.dataUri()).startsWith("data:image/png;base64,");
        assertThat(result.width()).isPositive();
        assertThat(result.height()).isPositive();
    }

    @Test
    @Tag("integration")
    void displayStyleIsTallerThanTextStyle() {
        TypesetResult text = typesetter.typeset("\\sum_{i=1}^{n} i", false);
        TypesetResult display = typesetter.typeset("\\sum_{i=1}^{n} i", true);

        assertThat(display.height()).isGreaterThan(text.height());
    }

    @Test
    @Tag("integration")
    void malformedFormulaNeverThrows() {
        TypesetResult result = typesetter.typeset("\\frac{", true);

        assertThat(result).isNotNull();
        if (!result.isSuccess()) {
            assertThat(result.error()).isNotNull();
        }
    }
}
