package org.texpreview.compiler.frontend.format;

import org.texpreview.compiler.diagnostics.CompilerLogger;
import org.texpreview.compiler.frontend.lexer.CommandMatch;
import org.texpreview.compiler.frontend.lexer.CommandScanner;
import org.texpreview.compiler.frontend.lexer.CommandSpec;
import org.texpreview.compiler.frontend.lexer.HeldSpans;
import org.texpreview.compiler.frontend.preprocessor.DocumentMetadata;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;
import org.texpreview.compiler.util.Lengths;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites text styling, spacing and break commands into inline HTML.
 * <p>
 * Math spans and image directives are swapped for placeholders before any rewrite and restored
 * afterwards, so nothing inside a formula or an image reference is touched. The last step
 * resolves escaped characters, {@code ~} and {@code \\}, and drops grouping braces.
 * <p>
 * Font-size directives such as {@code \large} open a span that is never closed; the size applies
 * to the rest of the output.
 */
public class InlineFormatter implements IRenderStage {

    /** Marks a paragraph break. */
    public static final String PARAGRAPH_BREAK = "\n<p class=\"tex-par\"></p>\n";
    /** Marks a forced page break. */
    public static final String PAGE_BREAK = "\n<div class=\"tex-page-break\" style=\"page-break-after:always\"></div>\n";
    /** Fallback for lengths that cannot be converted. */
    public static final String FALLBACK_LENGTH = "1em";

    private static final Pattern BLANK_LINES = Pattern.compile("\\n[ \\t]*\\n\\s*");

    private static final Map<String, String[]> STYLES = new LinkedHashMap<>();
    private static final Map<String, String> SIZES = new LinkedHashMap<>();
    private static final Map<String, String> SKIPS = Map.of("smallskip", "3pt", "medskip", "6pt", "bigskip", "12pt");
    private static final Map<String, String> QUADS = Map.of("quad", "1em", "qquad", "2em");

    static {
        STYLES.put("textbf", new String[]{"<strong>", "</strong>"});
        STYLES.put("textit", new String[]{"<em>", "</em>"});
        STYLES.put("emph", new String[]{"<em>", "</em>"});
        STYLES.put("underline", new String[]{"<u>", "</u>"});
        STYLES.put("texttt", new String[]{"<code>", "</code>"});
        STYLES.put("textsc", new String[]{"<span style=\"font-variant:small-caps\">", "</span>"});

        SIZES.put("tiny", "0.5em");
        SIZES.put("scriptsize", "0.7em");
        SIZES.put("footnotesize", "0.8em");
        SIZES.put("small", "0.9em");
        SIZES.put("normalsize", "1em");
        SIZES.put("large", "1.2em");
        SIZES.put("Large", "1.44em");
        SIZES.put("LARGE", "1.728em");
        SIZES.put("huge", "2.074em");
        SIZES.put("Huge", "2.488em");
    }

    private static final List<CommandSpec> STYLE_COMMANDS = STYLES.keySet().stream()
            .map(name -> CommandSpec.of(name, 1)).toList();
    private static final List<CommandSpec> SPACE_COMMANDS = List.of(
            CommandSpec.of("vspace", 1), CommandSpec.of("hspace", 1));
    private static final List<CommandSpec> SIMPLE_COMMANDS = simpleCommands();
    private static final List<CommandSpec> HELD_COMMANDS = List.of(CommandSpec.withOptional("includegraphics", 1));

    @Override
    public String name() {
        return "format";
    }

    @Override
    public String apply(String source, RenderContext context) {
        HeldSpans held = new HeldSpans();
        String mathFree = held.holdMath(source);
        String text = CommandScanner.rewrite(mathFree, HELD_COMMANDS, m -> held.hold(mathFree.substring(m.start(), m.end())));
        CompilerLogger.debug("InlineFormatter: {} math span(s) and image directive(s) held back", held.size());
        return held.restore(format(text, context.today()));
    }

    /**
     * Formats math-free text.
     * @param text The text without math spans.
     * @param today The date {@code \today} stands for.
     * @return The formatted text.
     */
    public static String format(String text, LocalDate today) {
        String result = styles(text);
        result = CommandScanner.rewrite(result, SPACE_COMMANDS, InlineFormatter::space);
        result = CommandScanner.rewrite(result, SIMPLE_COMMANDS, m -> simple(m, today));
        result = BLANK_LINES.matcher(result).replaceAll(Matcher.quoteReplacement(PARAGRAPH_BREAK));
        return resolveEscapes(result);
    }

    private static String styles(String text) {
        return CommandScanner.rewrite(text, STYLE_COMMANDS, m -> {
            String[] tags = STYLES.get(m.name());
            return tags[0] + styles(m.argument(0)) + tags[1];
        });
    }

    private static String space(CommandMatch m) {
        String css = Lengths.parse(m.argument(0)).map(Lengths.Length::toCss).orElse(FALLBACK_LENGTH);
        if (m.name().equals("vspace")) {
            return verticalGap(css);
        }
        return horizontalGap(css);
    }

    private static String verticalGap(String css) {
        return "\n<div class=\"tex-vspace\" style=\"height:" + css + "\"></div>\n";
    }

    private static String horizontalGap(String css) {
        return "<span class=\"tex-hspace\" style=\"display:inline-block;width:" + css + "\"></span>";
    }

    private static String simple(CommandMatch m, LocalDate today) {
        String name = m.name();
        if (SIZES.containsKey(name)) {
            return "<span style=\"font-size:" + SIZES.get(name) + "\">";
        }
        if (SKIPS.containsKey(name)) {
            return verticalGap(SKIPS.get(name));
        }
        if (QUADS.containsKey(name)) {
            return horizontalGap(QUADS.get(name));
        }
        return switch (name) {
            case "newline" -> "<br/>";
            case "par" -> PARAGRAPH_BREAK;
            case "newpage", "clearpage", "pagebreak" -> PAGE_BREAK;
            case "today" -> DocumentMetadata.formatDate(today);
            case "LaTeX" -> "L<sup>A</sup>T<sub>E</sub>X";
            case "TeX" -> "T<sub>E</sub>X";
            case "ldots", "dots" -> "&hellip;";
            default -> "";
        };
    }

    /**
     * Resolves escaped characters, {@code ~} and {@code \\} line breaks, and drops unescaped grouping braces.
     * @param text The text.
     * @return The text with literal characters.
     */
    static String resolveEscapes(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case '%', '#', '_', '{', '}' -> {
                        out.append(next);
                        i += 2;
                        continue;
                    }
                    case '&' -> {
                        out.append("&amp;");
                        i += 2;
                        continue;
                    }
                    case '$' -> {
                        out.append("&#36;");
                        i += 2;
                        continue;
                    }
                    case '\\' -> {
                        out.append("<br/>");
                        i = skipBreakLength(text, i + 2);
                        continue;
                    }
                    default -> { }
                }
            }
            if (c == '~') {
                out.append("&nbsp;");
            } else if (c != '{' && c != '}') {
                out.append(c);
            }
            i++;
        }
        return out.toString();
    }

    private static int skipBreakLength(String text, int pos) {
        if (pos < text.length() && text.charAt(pos) == '[') {
            int close = CommandScanner.findClosing(text, pos, '[', ']');
            if (close > 0) return close + 1;
        }
        return pos;
    }

    private static List<CommandSpec> simpleCommands() {
        List<CommandSpec> specs = new ArrayList<>();
        for (String name : SIZES.keySet()) specs.add(CommandSpec.of(name, 0));
        for (String name : SKIPS.keySet()) specs.add(CommandSpec.of(name, 0));
        for (String name : QUADS.keySet()) specs.add(CommandSpec.of(name, 0));
        for (String name : List.of("newline", "par", "newpage", "clearpage", "pagebreak", "today",
                "LaTeX", "TeX", "ldots", "dots", "noindent", "centering")) {
            specs.add(CommandSpec.of(name, 0));
        }
        return specs;
    }
}
