package org.texpreview.compiler.frontend.lexer;

/**
 * A matched {@code \begin{name} ... \end{name}} pair.
 *
 * @param name  The environment name.
 * @param start Index of the backslash of {@code \begin}.
 * @param end   Index just past the closing brace of {@code \end{name}}.
 * @param body  The raw text between the two markers, including any leading environment arguments.
 */
public record EnvironmentMatch(String name, int start, int end, String body) {
}
