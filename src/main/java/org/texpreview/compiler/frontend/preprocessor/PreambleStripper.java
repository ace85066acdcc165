package org.texpreview.compiler.frontend.preprocessor;

import org.texpreview.compiler.frontend.lexer.CommandMatch;
import org.texpreview.compiler.frontend.lexer.CommandScanner;
import org.texpreview.compiler.frontend.lexer.CommandSpec;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Removes comments and non-visual setup directives and reduces the source to the document body.
 * <p>
 * The body is the text between {@code \begin{document}} and the last {@code \end{document}}; if
 * either marker is missing the whole text is the body. Title, author, date and document class are
 * recorded as {@link DocumentMetadata} before the preamble is discarded.
 */
public class PreambleStripper implements IRenderStage {

    private static final String BEGIN_DOCUMENT = "\\begin{document}";
    private static final String END_DOCUMENT = "\\end{document}";

    private static final CommandSpec DOCUMENT_CLASS = CommandSpec.withOptional("documentclass", 1);
    private static final CommandSpec TITLE = CommandSpec.withOptional("title", 1);
    private static final CommandSpec AUTHOR = CommandSpec.of("author", 1);
    private static final CommandSpec DATE = CommandSpec.of("date", 1);
    private static final List<CommandSpec> TITLE_COMMANDS = List.of(TITLE, AUTHOR, DATE);

    @Override
    public String name() {
        return "strip";
    }

    @Override
    public String apply(String source, RenderContext context) {
        String text = stripComments(source);
        context.setMetadata(extractMetadata(text, context.today()));
        String body = extractBody(text);
        body = CommandScanner.remove(body, TITLE_COMMANDS);
        return CommandScanner.remove(body, context.getSettings().preambleDirectives());
    }

    /**
     * Removes every unescaped {@code %} and the rest of its line. Line breaks are kept.
     * @param text The source text.
     * @return The text without comments.
     */
    public static String stripComments(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append('\n');
            String line = lines[i];
            int percent = CommandScanner.indexOfUnescaped(line, "%", 0);
            out.append(percent >= 0 ? line.substring(0, percent) : line);
        }
        return out.toString();
    }

    /**
     * Extracts the document body.
     * @param text The comment-free source.
     * @return The text between the document markers, or the whole text if a marker is missing.
     */
    public static String extractBody(String text) {
        int begin = text.indexOf(BEGIN_DOCUMENT);
        int end = text.lastIndexOf(END_DOCUMENT);
        if (begin < 0 || end < begin + BEGIN_DOCUMENT.length()) {
            return text;
        }
        return text.substring(begin + BEGIN_DOCUMENT.length(), end);
    }

    /**
     * Reads the first occurrence of each title command and the document class.
     * @param text The comment-free source.
     * @param today The date {@code \today} stands for.
     * @return The metadata.
     */
    public static DocumentMetadata extractMetadata(String text, LocalDate today) {
        List<CommandMatch> matches = CommandScanner.findAll(text, List.of(DOCUMENT_CLASS, TITLE, AUTHOR, DATE));
        String date = first(matches, DATE)
                .map(d -> d.replace("\\today", DocumentMetadata.formatDate(today)))
                .orElse(null);
        return new DocumentMetadata(
                first(matches, DOCUMENT_CLASS).orElse(null),
                first(matches, TITLE).orElse(null),
                first(matches, AUTHOR).orElse(null),
                date);
    }

    private static Optional<String> first(List<CommandMatch> matches, CommandSpec spec) {
        return matches.stream()
                .filter(m -> m.name().equals(spec.name()))
                .findFirst()
                .map(m -> m.argument(0).trim());
    }
}
