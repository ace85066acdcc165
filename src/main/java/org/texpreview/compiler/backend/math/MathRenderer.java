package org.texpreview.compiler.backend.math;

import org.texpreview.compiler.api.CompilerErrorCode;
import org.texpreview.compiler.diagnostics.CompilerLogger;
import org.texpreview.compiler.frontend.lexer.CommandScanner;
import org.texpreview.compiler.frontend.lexer.CommandSpec;
import org.texpreview.compiler.frontend.lexer.MathScanner;
import org.texpreview.compiler.frontend.lexer.MathSegment;
import org.texpreview.compiler.internal.i18n.Messages;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;
import org.texpreview.compiler.util.HtmlEscapes;

import java.util.List;

/**
 * Replaces math spans with typeset images. A span the typesetter rejects is shown as its escaped
 * source; the other spans are unaffected. Equation labels are dropped before typesetting.
 */
public class MathRenderer implements IRenderStage {

    private static final List<CommandSpec> LABELS = List.of(CommandSpec.of("label", 1));

    @Override
    public String name() {
        return "math";
    }

    @Override
    public String apply(String source, RenderContext context) {
        return render(source, context.getMathTypesetter());
    }

    /**
     * Renders every math span of a text.
     * @param text The text.
     * @param typesetter The typesetter.
     * @return The text with typeset spans.
     */
    public String render(String text, IMathTypesetter typesetter) {
        StringBuilder out = new StringBuilder(text.length());
        int rendered = 0;
        int failed = 0;
        for (MathSegment segment : MathScanner.scan(text)) {
            if (!segment.isMath()) {
                out.append(segment.source());
                continue;
            }
            String latex = CommandScanner.remove(segment.content(), LABELS).trim();
            if (latex.isEmpty()) {
                continue;
            }
            boolean display = segment.kind() == MathSegment.Kind.DISPLAY;
            TypesetResult result = typeset(typesetter, latex, display);
            if (result.isSuccess()) {
                rendered++;
                out.append(display ? displayImage(result, latex) : inlineImage(result, latex));
            } else {
                failed++;
                out.append(fallback(segment, result.error()));
            }
        }
        CompilerLogger.debug("MathRenderer: {} span(s) rendered, {} left unparsed", rendered, failed);
        return out.toString();
    }

    private static TypesetResult typeset(IMathTypesetter typesetter, String latex, boolean display) {
        try {
            TypesetResult result = typesetter.typeset(latex, display);
            return result != null ? result : TypesetResult.failure("no result");
        } catch (RuntimeException e) {
            CompilerLogger.warn("MathRenderer: typesetter failed on '{}': {}", latex, e.toString());
            return TypesetResult.failure(e.toString());
        }
    }

    private static String image(TypesetResult result, String latex, String style) {
        return "<img class=\"tex-math\" src=\"" + HtmlEscapes.attribute(result.dataUri()) + "\" alt=\"" + HtmlEscapes.attribute(latex)
                + "\" width=\"" + result.width() + "\" height=\"" + result.height() + "\" style=\"" + style + "\"/>";
    }

    private static String displayImage(TypesetResult result, String latex) {
        return "\n<div class=\"tex-math-display\" style=\"text-align:center;margin:1em 0\">"
                + image(result, latex, "display:inline-block") + "</div>\n";
    }

    private static String inlineImage(TypesetResult result, String latex) {
        return "<span class=\"tex-math-inline\">" + image(result, latex, "vertical-align:middle") + "</span>";
    }

    private static String fallback(MathSegment segment, String error) {
        return "<span class=\"tex-math-unparsed\" style=\"font-family:monospace;color:#b00020\" title=\""
                + HtmlEscapes.attribute(Messages.get(CompilerErrorCode.MATH_SYNTAX_ERROR.messageKey(), error))
                + "\">" + HtmlEscapes.text(segment.source()) + "</span>";
    }
}
