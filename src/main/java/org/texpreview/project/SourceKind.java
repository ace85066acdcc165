package org.texpreview.project;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies project files by extension.
 */
public enum SourceKind {
    /** A markup source file served through the file resolver. */
    TEX,
    /** A raster or vector image served through the asset resolver. */
    IMAGE,
    /** Anything else; kept in the snapshot but never resolved. */
    OTHER;

    private static final Set<String> TEXT_EXTENSIONS = Set.of("tex", "ltx", "sty", "cls", "bib");
    private static final Map<String, String> IMAGE_TYPES = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "svg", "image/svg+xml",
            "bmp", "image/bmp",
            "webp", "image/webp");

    /**
     * @param fileName A file name.
     * @return The kind implied by its extension.
     */
    public static SourceKind of(String fileName) {
        String extension = extension(fileName);
        if (TEXT_EXTENSIONS.contains(extension)) return TEX;
        if (IMAGE_TYPES.containsKey(extension)) return IMAGE;
        return OTHER;
    }

    /**
     * @param fileName An image file name.
     * @return The MIME type of the image, or empty if the extension is not an image type.
     */
    public static Optional<String> mimeType(String fileName) {
        return Optional.ofNullable(IMAGE_TYPES.get(extension(fileName)));
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
