package org.texpreview.compiler.api;

import org.texpreview.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of one compile pass.
 *
 * @param renderedOutput The rendered HTML fragment. Empty if no entry file could be located.
 * @param diagnostics    The diagnostic log of the pass, in the order the entries were reported.
 */
public record CompileResult(String renderedOutput, List<Diagnostic> diagnostics) {

    public CompileResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if the log contains at least one error entry.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
