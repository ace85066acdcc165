package org.texpreview.compiler.frontend.structure;

import org.texpreview.compiler.diagnostics.CompilerLogger;
import org.texpreview.compiler.frontend.lexer.CommandMatch;
import org.texpreview.compiler.frontend.lexer.CommandScanner;
import org.texpreview.compiler.frontend.lexer.CommandSpec;
import org.texpreview.compiler.frontend.lexer.HeldSpans;
import org.texpreview.compiler.frontend.preprocessor.DocumentMetadata;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns headings into numbered heading blocks and resolves cross references.
 * <p>
 * Headings, {@code \label} and {@code \maketitle} are visited in one left-to-right pass that
 * threads a {@link SectionCounters} value; starred headings are rendered without a label and
 * leave the counters alone. A second pass replaces {@code \ref} with the label bound to its key,
 * or {@code ??} for unknown keys. Math spans are hidden from both passes, so a {@code \label}
 * inside an equation never binds to a heading.
 */
public class StructuralTransformer implements IRenderStage {

    private static final List<CommandSpec> COMMANDS = new ArrayList<>();
    private static final List<CommandSpec> REFERENCES = List.of(CommandSpec.of("ref", 1));

    static {
        for (HeadingLevel level : HeadingLevel.values()) {
            COMMANDS.add(CommandSpec.withOptional(level.command(), 1));
        }
        COMMANDS.add(CommandSpec.of("label", 1));
        COMMANDS.add(CommandSpec.of("maketitle", 0));
    }

    @Override
    public String name() {
        return "structure";
    }

    @Override
    public String apply(String source, RenderContext context) {
        HeldSpans math = new HeldSpans();
        String mathFree = math.holdMath(source);
        Pass pass = new Pass(context.getMetadata());
        String text = CommandScanner.rewrite(mathFree, COMMANDS, pass::rewrite);
        text = CommandScanner.rewrite(text, REFERENCES, m -> pass.reference(m.argument(0).trim()));
        return math.restore(text);
    }

    /**
     * Renders a heading block.
     * @param level The heading level.
     * @param label The computed label, empty if unnumbered.
     * @param title The title text.
     * @return The heading element.
     */
    static String renderHeading(HeadingLevel level, String label, String title) {
        String text = label.isEmpty() ? title : label + " " + title;
        return "\n<" + level.htmlTag() + " class=\"tex-" + level.command() + "\">" + text + "</" + level.htmlTag() + ">\n";
    }

    /**
     * Renders the title block for {@code \maketitle}.
     * @param metadata The document metadata.
     * @return The title block, or an empty string if there is nothing to show.
     */
    static String renderTitleBlock(DocumentMetadata metadata) {
        if (!metadata.hasTitleBlock()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n<div class=\"tex-title-block\" style=\"text-align:center\">");
        if (metadata.title() != null) {
            sb.append("<h1 class=\"tex-title\">").append(metadata.title()).append("</h1>");
        }
        if (metadata.author() != null) {
            sb.append("<div class=\"tex-author\">")
                    .append(metadata.author().replaceAll("\\s*\\\\and\\b\\s*", ", "))
                    .append("</div>");
        }
        if (metadata.date() != null) {
            sb.append("<div class=\"tex-date\">").append(metadata.date()).append("</div>");
        }
        return sb.append("</div>\n").toString();
    }

    private static final class Pass {
        private final DocumentMetadata metadata;
        private final Map<String, String> labels = new HashMap<>();
        private SectionCounters counters = SectionCounters.initial();
        private String lastLabel = "";

        Pass(DocumentMetadata metadata) {
            this.metadata = metadata;
        }

        String rewrite(CommandMatch match) {
            switch (match.name()) {
                case "label" -> {
                    labels.putIfAbsent(match.argument(0).trim(), lastLabel);
                    return "";
                }
                case "maketitle" -> {
                    return renderTitleBlock(metadata);
                }
                default -> {
                    HeadingLevel level = HeadingLevel.byCommand(match.name()).orElseThrow();
                    String label = "";
                    if (level.isNumbered() && !match.starred()) {
                        counters = counters.advance(level);
                        label = counters.label(level);
                        lastLabel = label;
                    }
                    CompilerLogger.trace("StructuralTransformer: {} '{}' -> '{}'", level, match.argument(0), label);
                    return renderHeading(level, label, match.argument(0).trim());
                }
            }
        }

        String reference(String key) {
            return labels.getOrDefault(key, "??");
        }
    }
}
