package org.texpreview.compiler.frontend.lexer;

import java.util.List;

/**
 * A single command occurrence found by the {@link CommandScanner}.
 *
 * @param name      The command name without the leading backslash.
 * @param start     Index of the backslash that starts the command.
 * @param end       Index just past the last consumed character (name, star or closing brace).
 * @param starred   Whether the name was followed by {@code *}.
 * @param optional  The content of the optional {@code [..]} argument, or {@code null}.
 * @param arguments The contents of the mandatory {@code {..}} arguments, in order.
 */
public record CommandMatch(
        String name,
        int start,
        int end,
        boolean starred,
        String optional,
        List<String> arguments
) {
    public CommandMatch {
        arguments = List.copyOf(arguments);
    }

    /**
     * @param index The zero-based argument index.
     * @return The mandatory argument at the given index.
     */
    public String argument(int index) {
        return arguments.get(index);
    }
}
