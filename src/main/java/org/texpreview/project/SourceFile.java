package org.texpreview.project;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * One immutable entry of a {@link ProjectSnapshot}.
 *
 * @param name    The basename of the file.
 * @param content The raw bytes.
 * @param kind    The kind derived from the extension.
 */
public record SourceFile(String name, byte[] content, SourceKind kind) {

    public SourceFile {
        content = content.clone();
    }

    /**
     * Creates a text file entry.
     * @param name The file name.
     * @param text The content, stored as UTF-8.
     * @return The entry.
     */
    public static SourceFile text(String name, String text) {
        return new SourceFile(name, text.getBytes(StandardCharsets.UTF_8), SourceKind.of(name));
    }

    /**
     * Creates an entry whose kind is derived from the name.
     * @param name The file name.
     * @param content The raw bytes.
     * @return The entry.
     */
    public static SourceFile of(String name, byte[] content) {
        return new SourceFile(name, content, SourceKind.of(name));
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    /**
     * @return The content decoded as UTF-8.
     */
    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /**
     * @return The content as a base64 data URI with the MIME type implied by the name.
     */
    public String dataUri() {
        String mime = SourceKind.mimeType(name).orElse("application/octet-stream");
        return "data:" + mime + ";base64," + Base64.getEncoder().encodeToString(content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceFile other)) return false;
        return name.equals(other.name) && kind == other.kind && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + kind.hashCode()) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SourceFile[name=" + name + ", kind=" + kind + ", bytes=" + content.length + "]";
    }
}
