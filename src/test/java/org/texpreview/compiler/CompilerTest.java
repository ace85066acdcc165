package org.texpreview.compiler;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.texpreview.compiler.api.CompileResult;
import org.texpreview.compiler.api.IFileResolver;
import org.texpreview.compiler.backend.math.IMathTypesetter;
import org.texpreview.compiler.backend.math.TypesetResult;
import org.texpreview.compiler.diagnostics.Diagnostic;
import org.texpreview.compiler.frontend.format.InlineFormatter;
import org.texpreview.compiler.frontend.preprocessor.IncludeResolver;
import org.texpreview.compiler.frontend.preprocessor.PreambleStripper;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;
import org.texpreview.compiler.pipeline.StageRegistry;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.texpreview.compiler.CompilerFixtures.ACCEPTING_TYPESETTER;
import static org.texpreview.compiler.CompilerFixtures.FIXED_CLOCK;
import static org.texpreview.compiler.CompilerFixtures.assets;
import static org.texpreview.compiler.CompilerFixtures.files;
import static org.texpreview.compiler.CompilerFixtures.settings;

/**
 * End-to-end tests of the rendering pipeline with in-memory resolvers.
 */
public class CompilerTest {

    private static final String PREAMBLE = "\\documentclass{report}\n\\begin{document}\n";
    private static final String END = "\n\\end{document}\n";

    private final Compiler compiler = new Compiler(settings(), ACCEPTING_TYPESETTER, FIXED_CLOCK);

    private static int occurrences(String text, String token) {
        return text.split(java.util.regex.Pattern.quote(token), -1).length - 1;
    }

    @Test
    @Tag("unit")
    void missingEntryYieldsSingleErrorAndEmptyOutput() {
        CompileResult result = compiler.compile("main.tex", files("notes.txt", "x"), assets());

        assertThat(result.renderedOutput()).isEmpty();
        assertThat(result.diagnostics()).hasSize(1);
        Diagnostic d = result.diagnostics().get(0);
        assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(d.message()).isEqualTo("No main LaTeX file found to compile.");
        assertThat(result.hasErrors()).isTrue();
    }

    @Test
    @Tag("unit")
    void emptyEntryFileIsFatal() {
        CompileResult result = compiler.compile("main.tex", files("main.tex", "", "other.tex", "text"), assets());

        assertThat(result.renderedOutput()).isEmpty();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.message()).isEqualTo("No main LaTeX file found to compile.");
        });
    }

    @Test
    @Tag("unit")
    void locatesEntryFile() {
        IFileResolver withMain = files("b.tex", "", "main.tex", "", "a.tex", "");
        IFileResolver withoutMain = files("b.tex", "", "a.tex", "");

        assertThat(compiler.locateEntry("b.tex", withMain)).contains("b.tex");
        assertThat(compiler.locateEntry("unknown.tex", withMain)).contains("main.tex");
        assertThat(compiler.locateEntry(null, withoutMain)).contains("a.tex");
        assertThat(compiler.locateEntry(null, files("x.png", ""))).isEmpty();
    }

    @Test
    @Tag("unit")
    void missingDocumentClassYieldsSingleWarning() {
        CompileResult result = compiler.compile("main.tex", files("main.tex", "% \\documentclass{article}\nHello"), assets());

        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.fileName()).isEqualTo("main.tex");
            assertThat(d.message()).contains("\\documentclass");
        });
        assertThat(result.renderedOutput()).contains("Hello");
    }

    @Test
    @Tag("unit")
    void successfulPassYieldsSingleInfoWithSize() {
        CompileResult result = compiler.compile("main.tex", files("main.tex", PREAMBLE + "Hello" + END), assets());

        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.INFO);
            assertThat(d.message()).startsWith("Compilation finished. Output: " + result.renderedOutput().length() + " characters");
            assertThat(d.timestamp()).isEqualTo(FIXED_CLOCK.millis());
        });
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void includeCycleTerminatesWithOneMarker() {
        IFileResolver files = files(
                "main.tex", PREAMBLE + "\\input{b}" + END,
                "b.tex", "in b \\input{main}");

        CompileResult result = compiler.compile("main.tex", files, assets());

        assertThat(occurrences(result.renderedOutput(), "recursive loop detected: main.tex")).isEqualTo(1);
        assertThat(result.renderedOutput()).contains("in b");
        assertThat(result.diagnostics()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void diamondInclusionRendersSharedFileTwice() {
        IFileResolver files = files(
                "main.tex", PREAMBLE + "\\input{b}\n\\input{c}" + END,
                "b.tex", "\\input{d}",
                "c.tex", "\\input{d}",
                "d.tex", "SHARED");

        CompileResult result = compiler.compile("main.tex", files, assets());

        assertThat(occurrences(result.renderedOutput(), "SHARED")).isEqualTo(2);
        assertThat(result.renderedOutput()).doesNotContain("recursive loop");
    }

    @Test
    @Tag("unit")
    void includedTextRendersLikeInlinedText() {
        String inlined = compiler.compile("main.tex",
                files("main.tex", PREAMBLE + "A\nx\nB" + END), assets()).renderedOutput();
        String included = compiler.compile("main.tex",
                files("main.tex", PREAMBLE + "A\n\\input{b}\nB" + END, "b.tex", "x"), assets()).renderedOutput();

        assertThat(included.replaceAll("<!--.*?-->", "")).isEqualTo(inlined);
        assertThat(included).doesNotContain("tex-par");
    }

    @Test
    @Tag("unit")
    void emptyIncludeIsMarkedMissing() {
        CompileResult result = compiler.compile("main.tex",
                files("main.tex", PREAMBLE + "\\input{empty}" + END, "empty.tex", ""), assets());

        assertThat(result.renderedOutput()).contains("missing file: empty.tex");
        assertThat(result.diagnostics()).singleElement().extracting(Diagnostic::type).isEqualTo(Diagnostic.Type.INFO);
    }

    @Test
    @Tag("unit")
    void strippedBodyReachesFormatterUnchanged() {
        List<String> seen = new ArrayList<>();
        StageRegistry registry = new StageRegistry();
        registry.register(new IncludeResolver());
        registry.register(new PreambleStripper());
        registry.register(new IRenderStage() {
            @Override
            public String name() {
                return "record";
            }

            @Override
            public String apply(String source, RenderContext context) {
                seen.add(source);
                return source;
            }
        });
        Compiler custom = new Compiler(settings(), ACCEPTING_TYPESETTER, FIXED_CLOCK, registry);
        String main = "\\documentclass{article}\n"
                + "\\usepackage{amsmath} % maths\n"
                + "\\begin{document}\n"
                + "Plain words, $x+y$ and \\textbf{markup}.\n"
                + "Second line. % note\n"
                + "\\end{document}\n";

        custom.compile("main.tex", files("main.tex", main), assets());

        assertThat(seen).containsExactly("\nPlain words, $x+y$ and \\textbf{markup}.\nSecond line. \n");
    }

    @Test
    @Tag("unit")
    void equationLabelIsNotAHeadingLabel() {
        String out = compiler.compile("main.tex", files("main.tex", PREAMBLE
                + "\\section{A}\\begin{equation}x\\label{eq:x}\\end{equation} see \\ref{eq:x}" + END), assets())
                .renderedOutput();

        assertThat(out).contains("see ??").doesNotContain("see 1");
        assertThat(out).contains("<h2 class=\"tex-section\">1 A</h2>");
    }

    @Test
    @Tag("unit")
    void numbersHeadingsAcrossIncludedFiles() {
        IFileResolver files = files(
                "main.tex", PREAMBLE + "\\chapter{One}\n\\input{two}\n\\chapter*{Appendix}\n\\chapter{Three}" + END,
                "two.tex", "\\chapter{Two}\n\\section{Detail}");

        String out = compiler.compile("main.tex", files, assets()).renderedOutput();

        assertThat(out).contains("<h1 class=\"tex-chapter\">1 One</h1>");
        assertThat(out).contains("<h1 class=\"tex-chapter\">2 Two</h1>");
        assertThat(out).contains("<h2 class=\"tex-section\">2.1 Detail</h2>");
        assertThat(out).contains("<h1 class=\"tex-chapter\">Appendix</h1>");
        assertThat(out).contains("<h1 class=\"tex-chapter\">3 Three</h1>");
    }

    @Test
    @Tag("unit")
    void missingImageIsMarkerNotDiagnostic() {
        CompileResult result = compiler.compile("main.tex",
                files("main.tex", PREAMBLE + "\\includegraphics{logo}\\includegraphics{ghost}" + END),
                assets("logo.png", "data:image/png;base64,TE9HTw=="));

        assertThat(result.renderedOutput()).contains("src=\"data:image/png;base64,TE9HTw==\"");
        assertThat(result.renderedOutput()).contains("missing image: ghost");
        assertThat(result.diagnostics()).singleElement().extracting(Diagnostic::type).isEqualTo(Diagnostic.Type.INFO);
    }

    @Test
    @Tag("unit")
    void mathFailureIsIsolatedToItsSpan() {
        IMathTypesetter picky = (latex, display) -> latex.equals("bad")
                ? TypesetResult.failure("nope")
                : TypesetResult.success("data:ok", 5, 5);
        Compiler pickyCompiler = new Compiler(settings(), picky, FIXED_CLOCK);

        String out = pickyCompiler.compile("main.tex",
                files("main.tex", PREAMBLE + "$good$ then $bad$ then $$fine$$" + END), assets()).renderedOutput();

        assertThat(occurrences(out, "src=\"data:ok\"")).isEqualTo(2);
        assertThat(out).contains("tex-math-unparsed").contains(">$bad$</span>");
    }

    @Test
    @Tag("unit")
    void failingStagePassesItsInputThrough() {
        StageRegistry registry = new StageRegistry();
        registry.register(new IRenderStage() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String apply(String source, RenderContext context) {
                throw new IllegalStateException("broken stage");
            }
        });
        registry.register(new InlineFormatter());
        Compiler custom = new Compiler(settings(), ACCEPTING_TYPESETTER, FIXED_CLOCK, registry);

        CompileResult result = custom.compile("main.tex", files("main.tex", "\\textbf{kept}"), assets());

        assertThat(result.renderedOutput()).isEqualTo("<strong>kept</strong>");
        assertThat(result.diagnostics()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void compilationIsDeterministic() {
        IFileResolver files = files("main.tex", PREAMBLE + "\\section{A}\n\\textbf{b} \\today $x$" + END);

        CompileResult first = compiler.compile("main.tex", files, assets());
        CompileResult second = compiler.compile("main.tex", files, assets());

        assertThat(second).isEqualTo(first);
    }

    @Test
    @Tag("unit")
    void malformedInputNeverThrows() {
        String[] sources = {
                "\\begin{itemize}\\item {unbalanced",
                "$$ \\frac{ $ \\[ ",
                "\\section{",
                "\\end{document}\\begin{document}",
                "\\includegraphics[width=]{}",
                "}}}{{{ \\\\\\ % \\"
        };
        for (String source : sources) {
            CompileResult result = compiler.compile("main.tex", files("main.tex", source), assets());
            assertThat(result.diagnostics()).as(source).hasSize(1);
        }
    }

    @Test
    @Tag("unit")
    void rendersCompleteDocument() {
        String main = "\\documentclass{article}\n"
                + "\\usepackage{graphicx}\n"
                + "\\title{Preview} \\author{Ada} \\date{\\today}\n"
                + "\\begin{document}\n"
                + "\\maketitle\n"
                + "\\begin{abstract}Short.\\end{abstract}\n"
                + "\\section{Intro}\\label{s:intro}\n"
                + "See \\ref{s:intro}. \\begin{itemize}\\item \\textbf{One}\\item Two\\end{itemize}\n"
                + "\\end{document}\n";

        String out = compiler.compile("main.tex", files("main.tex", main), assets()).renderedOutput();

        assertThat(out).contains("<h1 class=\"tex-title\">Preview</h1>");
        assertThat(out).contains("<div class=\"tex-date\">March 5, 2024</div>");
        assertThat(out).contains(">Abstract</div>Short.</div>");
        assertThat(out).contains("<h2 class=\"tex-section\">1 Intro</h2>");
        assertThat(out).contains("See 1.");
        assertThat(out).contains("<li><strong>One</strong></li>");
        assertThat(out).doesNotContain("\\usepackage").doesNotContain("\\begin");
    }
}
