package org.texpreview.compiler.diagnostics;

/**
 * Represents a single entry of the diagnostic log (error, warning, info) of one compile pass.
 *
 * @param id         Identifier of the entry, unique within its pass.
 * @param type       The severity of the entry.
 * @param message    The user-facing message.
 * @param fileName   The file the entry refers to, or {@code null}.
 * @param lineNumber The line the entry refers to, or {@code null}.
 * @param timestamp  Epoch milliseconds at which the entry was reported.
 */
public record Diagnostic(
        String id,
        Type type,
        String message,
        String fileName,
        Integer lineNumber,
        long timestamp
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A failure that prevents rendering. */
        ERROR,
        /** A problem that does not prevent rendering. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(type).append("] ");
        if (fileName != null) {
            sb.append(fileName);
            if (lineNumber != null) sb.append(':').append(lineNumber);
            sb.append(": ");
        }
        return sb.append(message).toString();
    }
}
