package org.texpreview.compiler.frontend.lexer;

/**
 * Describes the argument shape of a markup command for the {@link CommandScanner}.
 *
 * @param name             The command name without the leading backslash (e.g. "section").
 * @param optionalArgument Whether a bracketed optional argument may follow the name.
 * @param argumentCount    The number of mandatory brace-delimited arguments.
 */
public record CommandSpec(String name, boolean optionalArgument, int argumentCount) {

    /**
     * Creates a spec for a command without an optional argument.
     * @param name The command name.
     * @param argumentCount The number of mandatory arguments.
     * @return The spec.
     */
    public static CommandSpec of(String name, int argumentCount) {
        return new CommandSpec(name, false, argumentCount);
    }

    /**
     * Creates a spec for a command that accepts one optional argument before its mandatory ones.
     * @param name The command name.
     * @param argumentCount The number of mandatory arguments.
     * @return The spec.
     */
    public static CommandSpec withOptional(String name, int argumentCount) {
        return new CommandSpec(name, true, argumentCount);
    }
}
