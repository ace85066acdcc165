package org.texpreview.compiler.frontend.structure;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.texpreview.compiler.CompilerFixtures;
import org.texpreview.compiler.frontend.preprocessor.DocumentMetadata;
import org.texpreview.compiler.pipeline.RenderContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for heading numbering, cross references and the title block.
 */
public class StructuralTransformerTest {

    private final StructuralTransformer transformer = new StructuralTransformer();

    private String transform(String source) {
        return transformer.apply(source, CompilerFixtures.context());
    }

    @Test
    @Tag("unit")
    void numbersChaptersAndSections() {
        String out = transform("\\chapter{A}\\chapter{B}\\section{M}\\chapter*{Preface}\\chapter{C}");

        assertThat(out).contains("<h1 class=\"tex-chapter\">1 A</h1>");
        assertThat(out).contains("<h1 class=\"tex-chapter\">2 B</h1>");
        assertThat(out).contains("<h2 class=\"tex-section\">2.1 M</h2>");
        assertThat(out).contains("<h1 class=\"tex-chapter\">Preface</h1>");
        assertThat(out).contains("<h1 class=\"tex-chapter\">3 C</h1>");
    }

    @Test
    @Tag("unit")
    void labelInsideEquationDoesNotBindToHeading() {
        String out = transform("\\section{A}\\begin{equation}x\\label{eq:x}\\end{equation} see \\ref{eq:x}");

        assertThat(out).contains("\\begin{equation}x\\label{eq:x}\\end{equation}");
        assertThat(out).endsWith(" see ??");
    }

    @Test
    @Tag("unit")
    void headingTitleKeepsInlineMath() {
        String out = transform("\\section{Energy $E=mc^2$}\\label{s:e} see \\ref{s:e}");

        assertThat(out).contains("<h2 class=\"tex-section\">1 Energy $E=mc^2$</h2>");
        assertThat(out).endsWith(" see 1");
    }

    @Test
    @Tag("unit")
    void numbersSectionsWithoutChapters() {
        String out = transform("\\section{X}\\subsection{Y}\\subsection{Z}\\section{W}");

        assertThat(out).contains("<h2 class=\"tex-section\">1 X</h2>");
        assertThat(out).contains("<h3 class=\"tex-subsection\">1.1 Y</h3>");
        assertThat(out).contains("<h3 class=\"tex-subsection\">1.2 Z</h3>");
        assertThat(out).contains("<h2 class=\"tex-section\">2 W</h2>");
    }

    @Test
    @Tag("unit")
    void starredSectionKeepsCounters() {
        String out = transform("\\section{A}\\section*{Note}\\section{B}");

        assertThat(out).contains(">Note</h2>");
        assertThat(out).contains("<h2 class=\"tex-section\">2 B</h2>");
    }

    @Test
    @Tag("unit")
    void ignoresShortTitleAndLeavesSubsubsectionUnnumbered() {
        String out = transform("\\section[Short]{Long}\\subsubsection{Deep}");

        assertThat(out).contains("<h2 class=\"tex-section\">1 Long</h2>");
        assertThat(out).contains("<h4 class=\"tex-subsubsection\">Deep</h4>");
        assertThat(out).doesNotContain("Short");
    }

    @Test
    @Tag("unit")
    void resolvesReferencesToLabels() {
        String out = transform("\\section{Intro}\\label{sec:intro} see \\ref{sec:intro} and \\ref{missing}");

        assertThat(out).contains("see 1 and ??");
        assertThat(out).doesNotContain("\\label");
    }

    @Test
    @Tag("unit")
    void resolvesForwardReferences() {
        String out = transform("see \\ref{later} \\section{A}\\section{B}\\label{later}");

        assertThat(out).startsWith("see 2 ");
    }

    @Test
    @Tag("unit")
    void rendersTitleBlockAtMaketitle() {
        RenderContext context = CompilerFixtures.context();
        context.setMetadata(new DocumentMetadata("article", "Title", "Ada \\and Alan", "March 5, 2024"));

        String out = transformer.apply("\\maketitle\nBody", context);

        assertThat(out).contains("<h1 class=\"tex-title\">Title</h1>");
        assertThat(out).contains("<div class=\"tex-author\">Ada, Alan</div>");
        assertThat(out).contains("<div class=\"tex-date\">March 5, 2024</div>");
        assertThat(out).endsWith("Body");
    }

    @Test
    @Tag("unit")
    void maketitleWithoutMetadataRendersNothing() {
        assertThat(transform("\\maketitle Body")).isEqualTo(" Body");
    }
}
