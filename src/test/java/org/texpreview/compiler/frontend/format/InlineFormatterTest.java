package org.texpreview.compiler.frontend.format;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.texpreview.compiler.CompilerFixtures;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

public class InlineFormatterTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 5);

    private final InlineFormatter formatter = new InlineFormatter();

    private static String format(String text) {
        return InlineFormatter.format(text, DAY);
    }

    @Test
    @Tag("unit")
    void formatsNestedStyles() {
        assertThat(format("\\textbf{a \\emph{b}}")).isEqualTo("<strong>a <em>b</em></strong>");
        assertThat(format("\\underline{u} \\texttt{t} \\textit{i}")).isEqualTo("<u>u</u> <code>t</code> <em>i</em>");
        assertThat(format("\\textsc{Caps}")).isEqualTo("<span style=\"font-variant:small-caps\">Caps</span>");
    }

    @Test
    @Tag("unit")
    void leavesMathSpansUntouched() {
        String out = formatter.apply("\\textbf{x} $\\textbf{y}_1$ and \\[a \\\\ b\\]", CompilerFixtures.context());

        assertThat(out).isEqualTo("<strong>x</strong> $\\textbf{y}_1$ and \\[a \\\\ b\\]");
    }

    @Test
    @Tag("unit")
    void convertsVerticalSpace() {
        assertThat(format("\\vspace{1cm}")).contains("height:1cm");
        assertThat(format("\\vspace*{2mm}")).contains("height:2mm");
        assertThat(format("\\vspace{\\fill}")).contains("height:1em");
        assertThat(format("\\bigskip")).contains("height:12pt");
        assertThat(format("\\smallskip")).contains("height:3pt");
    }

    @Test
    @Tag("unit")
    void convertsHorizontalSpace() {
        assertThat(format("\\hspace{10pt}")).contains("width:9.96pt");
        assertThat(format("a\\quad b")).contains("width:1em");
        assertThat(format("a\\qquad b")).contains("width:2em");
    }

    @Test
    @Tag("unit")
    void convertsLineAndPageBreaks() {
        assertThat(format("a\\\\b")).isEqualTo("a<br/>b");
        assertThat(format("a\\\\[2mm]b")).isEqualTo("a<br/>b");
        assertThat(format("a\\newline b")).isEqualTo("a<br/> b");
        assertThat(format("a\n\n\nb")).isEqualTo("a" + InlineFormatter.PARAGRAPH_BREAK + "b");
        assertThat(format("a\\par b")).isEqualTo("a" + InlineFormatter.PARAGRAPH_BREAK + " b");
        assertThat(format("\\newpage")).contains("tex-page-break");
        assertThat(format("\\clearpage")).isEqualTo(format("\\pagebreak"));
    }

    @Test
    @Tag("unit")
    void fontSizeScopeIsNeverClosed() {
        assertThat(format("\\large Big text")).isEqualTo("<span style=\"font-size:1.2em\"> Big text");
        assertThat(format("{\\small a} b")).isEqualTo("<span style=\"font-size:0.9em\"> a b");
    }

    @Test
    @Tag("unit")
    void resolvesEscapedCharacters() {
        assertThat(format("50\\% \\& \\#1 a\\_b \\{x\\} \\$5 ~"))
                .isEqualTo("50% &amp; #1 a_b {x} &#36;5 &nbsp;");
    }

    @Test
    @Tag("unit")
    void dropsGroupingBraces() {
        assertThat(format("{abc}")).isEqualTo("abc");
    }

    @Test
    @Tag("unit")
    void expandsTextMacros() {
        assertThat(format("\\today")).isEqualTo("March 5, 2024");
        assertThat(format("\\LaTeX")).contains("<sup>A</sup>");
        assertThat(format("wait\\ldots")).isEqualTo("wait&hellip;");
        assertThat(format("\\noindent Text")).isEqualTo(" Text");
    }

    @Test
    @Tag("unit")
    void escapedDollarDoesNotStartMath() {
        String out = formatter.apply("costs \\$5 and \\$6", CompilerFixtures.context());

        assertThat(out).isEqualTo("costs &#36;5 and &#36;6");
    }
}
