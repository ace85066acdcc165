package org.texpreview.compiler.util;

import org.jsoup.nodes.Entities;

/**
 * Escaping of generated HTML. Text content and attribute values differ in whether double quotes
 * must be escaped.
 */
public final class HtmlEscapes {

    private HtmlEscapes() {}

    /**
     * @param value Raw text.
     * @return The text safe to place between tags.
     */
    public static String text(String value) {
        return Entities.escape(value);
    }

    /**
     * @param value A raw attribute value.
     * @return The value safe to place inside a double-quoted attribute.
     */
    public static String attribute(String value) {
        return Entities.escape(value).replace("\"", "&quot;");
    }
}
