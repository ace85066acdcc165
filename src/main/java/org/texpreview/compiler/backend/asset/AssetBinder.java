package org.texpreview.compiler.backend.asset;

import org.texpreview.compiler.api.CompilerErrorCode;
import org.texpreview.compiler.diagnostics.CompilerLogger;
import org.texpreview.compiler.frontend.lexer.CommandMatch;
import org.texpreview.compiler.frontend.lexer.CommandScanner;
import org.texpreview.compiler.frontend.lexer.CommandSpec;
import org.texpreview.compiler.internal.i18n.Messages;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;
import org.texpreview.compiler.util.HtmlEscapes;
import org.texpreview.compiler.util.Lengths;

import java.util.List;
import java.util.Optional;

/**
 * Replaces {@code \includegraphics[opts]{path}} with an image bound to its data reference, or with a
 * missing-image marker when the name cannot be resolved.
 */
public class AssetBinder implements IRenderStage {

    private static final List<CommandSpec> INCLUDE_GRAPHICS = List.of(CommandSpec.withOptional("includegraphics", 1));

    @Override
    public String name() {
        return "assets";
    }

    @Override
    public String apply(String source, RenderContext context) {
        return bind(source, context.getAssets(), context.getSettings().referencePageWidthCm());
    }

    /**
     * Binds every image directive of a text.
     * @param body The text.
     * @param binding The asset binding of the pass.
     * @param referenceWidthCm Page width for absolute width options.
     * @return The text with images or markers.
     */
    public String bind(String body, AssetBinding binding, double referenceWidthCm) {
        return CommandScanner.rewrite(body, INCLUDE_GRAPHICS, m -> render(m, binding, referenceWidthCm));
    }

    /**
     * @param path The directive argument.
     * @return The part after the last {@code /}.
     */
    public static String basename(String path) {
        String trimmed = path.trim();
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private String render(CommandMatch match, AssetBinding binding, double referenceWidthCm) {
        String name = basename(match.argument(0));
        Optional<String> ref = binding.resolve(name);
        if (ref.isEmpty()) {
            CompilerLogger.debug("AssetBinder: no image for '{}'", name);
            return "<span class=\"tex-marker tex-missing-image\">"
                    + HtmlEscapes.text(Messages.get(CompilerErrorCode.MISSING_ASSET.messageKey(), name))
                    + "</span>";
        }
        double maxWidth = widthPercent(match.optional(), referenceWidthCm).orElse(100.0);
        return "<img class=\"tex-image\" src=\"" + HtmlEscapes.attribute(ref.get()) + "\" alt=\"" + HtmlEscapes.attribute(name)
                + "\" style=\"display:block;margin:1em auto;max-width:" + Lengths.format(maxWidth) + "%\"/>";
    }

    /**
     * Reads the {@code width=} key of an options list.
     * @param options The option text, e.g. {@code width=0.5\textwidth, angle=90}, or {@code null}.
     * @param referenceWidthCm Page width for absolute widths.
     * @return The width as a percentage of the text width, or empty.
     */
    static Optional<Double> widthPercent(String options, double referenceWidthCm) {
        if (options == null) return Optional.empty();
        for (String option : options.split(",")) {
            int eq = option.indexOf('=');
            if (eq > 0 && option.substring(0, eq).trim().equals("width")) {
                return Lengths.toWidthPercent(option.substring(eq + 1).trim(), referenceWidthCm);
            }
        }
        return Optional.empty();
    }
}
