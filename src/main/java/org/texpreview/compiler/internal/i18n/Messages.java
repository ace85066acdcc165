package org.texpreview.compiler.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Texts of inline markers, diagnostics and rendered labels, read from the
 * {@code compiler_messages} bundle. Markers are part of the rendered output, so the bundle is
 * loaded once and never switched at runtime.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "compiler_messages";
    private static final ResourceBundle BUNDLE = loadBundle();

    private Messages() {}

    /**
     * @param key The message key.
     * @return The message, or {@code !key!} if the bundle has no such key.
     */
    public static String get(String key) {
        try {
            return BUNDLE.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    /**
     * Formats a message with {@link MessageFormat} placeholders such as {@code {0}}.
     * @param key The message key.
     * @param args The values for the placeholders.
     * @return The formatted message.
     */
    public static String get(String key, Object... args) {
        return MessageFormat.format(get(key), args);
    }

    private static ResourceBundle loadBundle() {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.getDefault());
        } catch (MissingResourceException e) {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ROOT);
        }
    }
}
