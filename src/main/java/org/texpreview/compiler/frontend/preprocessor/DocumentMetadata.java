package org.texpreview.compiler.frontend.preprocessor;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Title-block information and the document class found in the assembled source.
 *
 * @param documentClass The declared document class, or {@code null} if none was declared.
 * @param title         The argument of {@code \title}, or {@code null}.
 * @param author        The argument of {@code \author}, or {@code null}.
 * @param date          The argument of {@code \date} with {@code \today} resolved, or {@code null}.
 */
public record DocumentMetadata(String documentClass, String title, String author, String date) {

    /** Metadata of a source without any declarations. */
    public static final DocumentMetadata EMPTY = new DocumentMetadata(null, null, null, null);

    private static final DateTimeFormatter TODAY = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    /**
     * @return {@code true} if a document class was declared.
     */
    public boolean hasDocumentClass() {
        return documentClass != null;
    }

    /**
     * @return {@code true} if there is anything to show in a title block.
     */
    public boolean hasTitleBlock() {
        return title != null || author != null || date != null;
    }

    /**
     * Formats a date the way {@code \today} prints it.
     * @param date The date.
     * @return The formatted date, e.g. "March 4, 2025".
     */
    public static String formatDate(LocalDate date) {
        return TODAY.format(date);
    }
}
