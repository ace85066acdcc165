package org.texpreview.compiler.frontend.environment;

import org.texpreview.compiler.diagnostics.CompilerLogger;
import org.texpreview.compiler.frontend.lexer.CommandMatch;
import org.texpreview.compiler.frontend.lexer.CommandScanner;
import org.texpreview.compiler.frontend.lexer.CommandSpec;
import org.texpreview.compiler.frontend.lexer.EnvironmentMatch;
import org.texpreview.compiler.internal.i18n.Messages;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;
import org.texpreview.compiler.util.Lengths;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Renders block environments: lists, abstract, minipage, multicols, center and figure.
 * <p>
 * Environments are handled innermost first, so a nested list is already rendered when its parent
 * is split into items. A {@code \begin} without a matching {@code \end} is left as literal text.
 */
public class EnvironmentHandler implements IRenderStage {

    /** The environment names this stage renders. */
    public static final Set<String> HANDLED = Set.of(
            "itemize", "enumerate", "abstract", "minipage", "multicols", "center", "figure");

    private static final List<CommandSpec> ITEM = List.of(CommandSpec.withOptional("item", 0));
    private static final List<CommandSpec> CAPTION = List.of(CommandSpec.withOptional("caption", 1));

    @Override
    public String name() {
        return "environment";
    }

    @Override
    public String apply(String source, RenderContext context) {
        double referenceWidthCm = context.getSettings().referencePageWidthCm();
        String text = source;
        Optional<EnvironmentMatch> next = CommandScanner.findInnermostEnvironment(text, HANDLED);
        while (next.isPresent()) {
            EnvironmentMatch env = next.get();
            CompilerLogger.trace("EnvironmentHandler: {} at {}", env.name(), env.start());
            text = text.substring(0, env.start()) + render(env, referenceWidthCm) + text.substring(env.end());
            next = CommandScanner.findInnermostEnvironment(text, HANDLED);
        }
        return text;
    }

    /**
     * Renders a single environment whose body contains no handled environment.
     * @param env The environment.
     * @param referenceWidthCm Page width for absolute minipage widths.
     * @return The rendered block.
     */
    static String render(EnvironmentMatch env, double referenceWidthCm) {
        return switch (env.name()) {
            case "itemize" -> renderList("ul", "tex-itemize", env.body());
            case "enumerate" -> renderList("ol", "tex-enumerate", env.body());
            case "abstract" -> renderAbstract(env.body());
            case "minipage" -> renderMinipage(env.body(), referenceWidthCm);
            case "multicols" -> renderMulticols(env.body());
            case "center" -> "\n<div class=\"tex-center\" style=\"text-align:center\">" + env.body().trim() + "</div>\n";
            case "figure" -> renderFigure(env.body());
            default -> throw new IllegalArgumentException("Unhandled environment: " + env.name());
        };
    }

    private static String renderList(String tag, String cssClass, String body) {
        List<CommandMatch> items = CommandScanner.findAll(body, ITEM);
        StringBuilder sb = new StringBuilder("\n<").append(tag).append(" class=\"").append(cssClass).append("\">\n");
        if (!items.isEmpty()) {
            String lead = body.substring(0, items.get(0).start()).trim();
            if (!lead.isEmpty()) {
                sb.append(lead).append('\n');
            }
        }
        for (int i = 0; i < items.size(); i++) {
            CommandMatch item = items.get(i);
            int end = i + 1 < items.size() ? items.get(i + 1).start() : body.length();
            String content = body.substring(item.end(), end).trim();
            if (item.optional() != null) {
                sb.append("<li style=\"list-style:none\"><span class=\"tex-item-label\">")
                        .append(item.optional().trim()).append("</span> ");
            } else {
                sb.append("<li>");
            }
            sb.append(content).append("</li>\n");
        }
        if (items.isEmpty() && !body.isBlank()) {
            sb.append(body.trim()).append('\n');
        }
        return sb.append("</").append(tag).append(">\n").toString();
    }

    private static String renderAbstract(String body) {
        return "\n<div class=\"tex-abstract\" style=\"margin:2em 4em;text-align:justify\">"
                + "<div class=\"tex-abstract-title\" style=\"text-align:center;font-weight:bold\">"
                + Messages.get("label.abstract") + "</div>"
                + body.trim() + "</div>\n";
    }

    private static String renderMinipage(String body, double referenceWidthCm) {
        Optional<CommandMatch> args = CommandScanner.leadingArguments(body, true, 1);
        double percent = 100.0;
        String align = "top";
        String content = body;
        if (args.isPresent()) {
            CommandMatch m = args.get();
            percent = Lengths.toWidthPercent(m.argument(0), referenceWidthCm).orElse(100.0);
            align = verticalAlign(m.optional());
            content = body.substring(m.end());
        }
        return "<div class=\"tex-minipage\" style=\"display:inline-block;vertical-align:" + align
                + ";width:" + Lengths.format(percent) + "%\">" + content.trim() + "</div>";
    }

    private static String verticalAlign(String position) {
        if (position == null) return "top";
        return switch (position.trim()) {
            case "b" -> "bottom";
            case "c" -> "middle";
            default -> "top";
        };
    }

    private static String renderMulticols(String body) {
        Optional<CommandMatch> args = CommandScanner.leadingArguments(body, false, 1);
        int columns = 2;
        String content = body;
        if (args.isPresent()) {
            content = body.substring(args.get().end());
            try {
                columns = Math.max(1, Integer.parseInt(args.get().argument(0).trim()));
            } catch (NumberFormatException e) {
                CompilerLogger.debug("EnvironmentHandler: column count '{}' is not a number, using {}",
                        args.get().argument(0), columns);
            }
        }
        return "\n<div class=\"tex-multicols\" style=\"column-count:" + columns + ";column-gap:2em\">"
                + content.trim() + "</div>\n";
    }

    private static String renderFigure(String body) {
        String content = CommandScanner.leadingArguments(body, true, 0)
                .map(m -> body.substring(m.end()))
                .orElse(body);
        content = CommandScanner.rewrite(content, CAPTION,
                m -> "<figcaption class=\"tex-caption\">" + m.argument(0).trim() + "</figcaption>");
        return "\n<figure class=\"tex-figure\" style=\"text-align:center\">" + content.trim() + "</figure>\n";
    }
}
