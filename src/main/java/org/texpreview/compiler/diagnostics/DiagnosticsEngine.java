package org.texpreview.compiler.diagnostics;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostic log of one compile pass.
 * <p>
 * The log is append-only and kept separate from the inline markers embedded in the rendered
 * output. A new engine is created for every pass.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Clock clock;

    /**
     * Creates an engine that timestamps entries with the given clock.
     * @param clock The clock for entry timestamps.
     */
    public DiagnosticsEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The file in which the error occurred, or {@code null}.
     * @param lineNumber The line number of the error, or {@code null}.
     */
    public void reportError(String message, String fileName, Integer lineNumber) {
        add(Diagnostic.Type.ERROR, message, fileName, lineNumber);
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The file in which the warning occurred, or {@code null}.
     * @param lineNumber The line number of the warning, or {@code null}.
     */
    public void reportWarning(String message, String fileName, Integer lineNumber) {
        add(Diagnostic.Type.WARNING, message, fileName, lineNumber);
    }

    /**
     * Reports an informational message.
     *
     * @param message  The message.
     * @param fileName The file the message refers to, or {@code null}.
     */
    public void reportInfo(String message, String fileName) {
        add(Diagnostic.Type.INFO, message, fileName, null);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    private void add(Diagnostic.Type type, String message, String fileName, Integer lineNumber) {
        String id = "diag-" + (diagnostics.size() + 1);
        diagnostics.add(new Diagnostic(id, type, message, fileName, lineNumber, clock.millis()));
    }
}
