package org.texpreview.compiler.api;

/**
 * Thrown when a project cannot be prepared for compilation, e.g. because its directory cannot be read.
 * <p>
 * Document content never causes this exception; it is reported through the diagnostic log instead.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
