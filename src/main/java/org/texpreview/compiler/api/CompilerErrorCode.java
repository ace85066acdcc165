package org.texpreview.compiler.api;

/**
 * The kinds of problems a compile pass can encounter. Only {@link #FATAL_NO_ENTRY} prevents
 * rendering; every other kind degrades to an inline marker or a diagnostic entry.
 */
public enum CompilerErrorCode {
    /** An inclusion directive names a file the resolver does not know. */
    MISSING_INCLUDE("marker.missing-file"),
    /** An inclusion directive names a file already being expanded on the current branch. */
    INCLUSION_CYCLE("marker.include-cycle"),
    /** An image directive names an asset that cannot be resolved. */
    MISSING_ASSET("marker.missing-image"),
    /** The math typesetter rejected a span. */
    MATH_SYNTAX_ERROR("marker.math-unparsed"),
    /** The assembled source never declares a document class. */
    STRUCTURAL_WARNING("diagnostic.no-documentclass"),
    /** No entry file can be located. */
    FATAL_NO_ENTRY("diagnostic.no-entry");

    private final String messageKey;

    CompilerErrorCode(String messageKey) {
        this.messageKey = messageKey;
    }

    /**
     * @return The key of the user-facing text in the {@code compiler_messages} bundle.
     */
    public String messageKey() {
        return messageKey;
    }
}
