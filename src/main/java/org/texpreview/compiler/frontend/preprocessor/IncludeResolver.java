package org.texpreview.compiler.frontend.preprocessor;

import org.texpreview.compiler.api.CompilerErrorCode;
import org.texpreview.compiler.api.IFileResolver;
import org.texpreview.compiler.diagnostics.CompilerLogger;
import org.texpreview.compiler.frontend.lexer.CommandMatch;
import org.texpreview.compiler.frontend.lexer.CommandScanner;
import org.texpreview.compiler.frontend.lexer.CommandSpec;
import org.texpreview.compiler.internal.i18n.Messages;
import org.texpreview.compiler.pipeline.IRenderStage;
import org.texpreview.compiler.pipeline.RenderContext;
import org.texpreview.compiler.util.HtmlEscapes;

import java.util.List;
import java.util.Optional;

/**
 * Expands {@code \input{path}} and {@code \include{path}} directives into one logical source.
 * <p>
 * Targets are looked up by basename, with the default extension appended when the name has no
 * extension. An included file is expanded recursively and wrapped in begin/end comments that add no
 * line breaks of their own. A target already being expanded on the current branch is replaced by a
 * cycle marker, an unknown or empty target by a missing-file marker; in both cases the remaining
 * directives are still processed. Directives inside a comment are left for the stripper.
 */
public class IncludeResolver implements IRenderStage {

    /** Extension appended to targets without one when no settings are available. */
    public static final String DEFAULT_EXTENSION = ".tex";

    private static final List<CommandSpec> DIRECTIVES = List.of(
            CommandSpec.of("input", 1),
            CommandSpec.of("include", 1));

    @Override
    public String name() {
        return "include";
    }

    @Override
    public String apply(String source, RenderContext context) {
        return resolve(source, context.getFiles(), ImportFrame.root(context.getEntryFileName()),
                context.getSettings().defaultExtension());
    }

    /**
     * Resolves all inclusion directives of a text that is not itself a named file.
     * @param entryContent The text to expand.
     * @param files The file resolver.
     * @return The expanded text.
     */
    public String resolve(String entryContent, IFileResolver files) {
        return resolve(entryContent, files, ImportFrame.empty(), DEFAULT_EXTENSION);
    }

    /**
     * Resolves all inclusion directives of a text on a given branch.
     * @param content The text to expand.
     * @param files The file resolver.
     * @param frame The files already being expanded on this branch.
     * @param defaultExtension The extension appended to targets without one.
     * @return The expanded text.
     */
    public String resolve(String content, IFileResolver files, ImportFrame frame, String defaultExtension) {
        return CommandScanner.rewrite(content, DIRECTIVES, match -> {
            if (isInComment(content, match.start())) {
                return content.substring(match.start(), match.end());
            }
            return expand(match, files, frame, defaultExtension);
        });
    }

    /**
     * Computes the file name an inclusion target refers to.
     * @param path The directive argument, possibly with directories.
     * @param defaultExtension The extension appended to names without one.
     * @return The basename with extension.
     */
    public static String targetName(String path, String defaultExtension) {
        String trimmed = path.trim();
        String name = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        return name.contains(".") ? name : name + defaultExtension;
    }

    private String expand(CommandMatch match, IFileResolver files, ImportFrame frame, String defaultExtension) {
        String name = targetName(match.argument(0), defaultExtension);
        if (frame.contains(name)) {
            CompilerLogger.debug("IncludeResolver: cycle on '{}' at depth {}", name, frame.depth());
            return marker(CompilerErrorCode.INCLUSION_CYCLE, name);
        }
        Optional<String> included = files.lookup(name).filter(content -> !content.isEmpty());
        if (included.isEmpty()) {
            CompilerLogger.debug("IncludeResolver: '{}' not found", name);
            return marker(CompilerErrorCode.MISSING_INCLUDE, name);
        }
        String expanded = resolve(included.get(), files, frame.with(name), defaultExtension);
        return "<!-- " + Messages.get("marker.include-begin", name) + " -->"
                + expanded
                + "<!-- " + Messages.get("marker.include-end", name) + " -->";
    }

    private static String marker(CompilerErrorCode code, String name) {
        String cssClass = code == CompilerErrorCode.INCLUSION_CYCLE ? "tex-include-cycle" : "tex-missing-include";
        return "<span class=\"tex-marker " + cssClass + "\">"
                + HtmlEscapes.text(Messages.get(code.messageKey(), name))
                + "</span>";
    }

    private static boolean isInComment(String text, int index) {
        int lineStart = text.lastIndexOf('\n', index - 1) + 1;
        int percent = CommandScanner.indexOfUnescaped(text, "%", lineStart);
        return percent >= 0 && percent < index;
    }
}
