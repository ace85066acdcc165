package org.texpreview.cli.rendering;

import org.texpreview.compiler.api.CompileResult;
import org.texpreview.compiler.diagnostics.Diagnostic;
import org.texpreview.compiler.util.HtmlEscapes;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Wraps a rendered fragment into a standalone HTML page with a page-like layout and the
 * diagnostic log below it.
 */
public class HtmlPageRenderer {

    private static final String TEMPLATE_RESOURCE = "templates/preview-page.html";

    private final String template;

    public HtmlPageRenderer() {
        this.template = loadTemplate();
    }

    /**
     * Renders a page.
     * @param result The compile result.
     * @param title The page title, usually the project directory name.
     * @return The HTML document.
     */
    public String render(CompileResult result, String title) {
        StringBuilder diagnostics = new StringBuilder();
        for (Diagnostic d : result.diagnostics()) {
            diagnostics.append("<li class=\"").append(d.type()).append("\">")
                    .append(HtmlEscapes.text(d.toString()))
                    .append("</li>\n");
        }
        return template
                .replace("${title}", HtmlEscapes.text(title))
                .replace("${diagnostics}", diagnostics.toString())
                .replace("${body}", result.renderedOutput());
    }

    private static String loadTemplate() {
        try (InputStream in = HtmlPageRenderer.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource: " + TEMPLATE_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + TEMPLATE_RESOURCE, e);
        }
    }
}
