package org.texpreview.compiler.backend.math;

/**
 * Outcome of typesetting one formula.
 *
 * @param dataUri The rendered image as a data URI, or {@code null} on failure.
 * @param width   The image width in pixels.
 * @param height  The image height in pixels.
 * @param error   The failure reason, or {@code null} on success.
 */
public record TypesetResult(String dataUri, int width, int height, String error) {

    public static TypesetResult success(String dataUri, int width, int height) {
        return new TypesetResult(dataUri, width, height, null);
    }

    public static TypesetResult failure(String error) {
        return new TypesetResult(null, 0, 0, error == null ? "" : error);
    }

    public boolean isSuccess() {
        return dataUri != null;
    }
}
