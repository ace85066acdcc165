package org.texpreview.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.texpreview.compiler.frontend.lexer.CommandSpec;

import java.util.List;

/**
 * Immutable settings of a {@link Compiler}, read from the {@code texpreview.compiler} section of
 * the HOCON configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * texpreview.compiler {
 *   entry-file = "main.tex"
 *   default-extension = ".tex"
 *   image-extensions = [".png", ".jpg", ".jpeg", ".gif", ".svg"]
 *   reference-page-width-cm = 21
 *   math-font-size = 18
 *   preamble-directives = [ { name = "usepackage", arguments = 1 } ]
 * }
 * </pre>
 *
 * @param entryFile             The default entry file tried when the requested one is unknown.
 * @param defaultExtension      Extension appended to inclusion targets that have none.
 * @param imageExtensions       Raster extensions tried when binding image names.
 * @param referencePageWidthCm  Page width against which absolute layout widths are converted.
 * @param mathFontSize          Point size used by the math typesetter.
 * @param preambleDirectives    Setup directives dropped from the body.
 */
public record CompilerSettings(
        String entryFile,
        String defaultExtension,
        List<String> imageExtensions,
        double referencePageWidthCm,
        float mathFontSize,
        List<CommandSpec> preambleDirectives
) {
    /** Configuration path of the compiler section. */
    public static final String CONFIG_PATH = "texpreview.compiler";

    public CompilerSettings {
        imageExtensions = List.copyOf(imageExtensions);
        preambleDirectives = List.copyOf(preambleDirectives);
    }

    /**
     * Reads settings from a compiler configuration section.
     * @param config The {@code texpreview.compiler} section.
     * @return The settings.
     */
    public static CompilerSettings fromConfig(Config config) {
        List<CommandSpec> directives = config.getConfigList("preamble-directives").stream()
                .map(c -> new CommandSpec(
                        c.getString("name"),
                        !c.hasPath("optional") || c.getBoolean("optional"),
                        c.getInt("arguments")))
                .toList();
        return new CompilerSettings(
                config.getString("entry-file"),
                config.getString("default-extension"),
                config.getStringList("image-extensions"),
                config.getDouble("reference-page-width-cm"),
                (float) config.getDouble("math-font-size"),
                directives);
    }

    /**
     * Reads settings from the classpath defaults ({@code reference.conf}).
     * @return The default settings.
     */
    public static CompilerSettings defaults() {
        return fromConfig(ConfigFactory.load().getConfig(CONFIG_PATH));
    }
}
