package org.texpreview.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Escape-aware scanner for markup commands and environments.
 * <p>
 * Instead of matching commands with flat regular expressions, the scanner locates a command name,
 * then reads its optional and mandatory arguments with balanced-brace counting. A command whose
 * mandatory arguments are missing or unbalanced is not matched and stays in the text verbatim.
 */
public final class CommandScanner {

    private CommandScanner() {}

    /**
     * Checks whether the character at {@code index} is escaped, i.e. preceded by an odd number
     * of backslashes.
     * @param text The text.
     * @param index The character index.
     * @return {@code true} if the character is escaped.
     */
    public static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    /**
     * Finds the next occurrence of {@code token} at or after {@code from} whose first character is not escaped.
     * @param text The text to search.
     * @param token The token to find.
     * @param from The start index.
     * @return The index of the token, or -1.
     */
    public static int indexOfUnescaped(String text, String token, int from) {
        int idx = text.indexOf(token, from);
        while (idx >= 0 && isEscaped(text, idx)) {
            idx = text.indexOf(token, idx + 1);
        }
        return idx;
    }

    /**
     * Finds the next complete occurrence of any of the given commands.
     * @param text The text to scan.
     * @param from The index to start scanning at.
     * @param specs The commands to look for, keyed by name.
     * @return The first complete match, or empty if none exists.
     */
    public static Optional<CommandMatch> find(String text, int from, Map<String, CommandSpec> specs) {
        int i = text.indexOf('\\', from);
        while (i >= 0) {
            int nameEnd = i + 1;
            while (nameEnd < text.length() && Character.isLetter(text.charAt(nameEnd))) {
                nameEnd++;
            }
            if (nameEnd > i + 1 && !isEscaped(text, i)) {
                CommandSpec spec = specs.get(text.substring(i + 1, nameEnd));
                if (spec != null) {
                    CommandMatch match = readArguments(text, i, nameEnd, spec);
                    if (match != null) {
                        return Optional.of(match);
                    }
                }
            }
            i = text.indexOf('\\', Math.max(nameEnd, i + 1));
        }
        return Optional.empty();
    }

    /**
     * Replaces every complete occurrence of the given commands with the replacer's output.
     * Matches are visited left to right; text between matches is copied unchanged.
     * @param text The text to rewrite.
     * @param specs The commands to replace.
     * @param replacer Produces the replacement text for a match.
     * @return The rewritten text.
     */
    public static String rewrite(String text, Collection<CommandSpec> specs, Function<CommandMatch, String> replacer) {
        Map<String, CommandSpec> byName = index(specs);
        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        Optional<CommandMatch> next = find(text, pos, byName);
        while (next.isPresent()) {
            CommandMatch match = next.get();
            out.append(text, pos, match.start());
            out.append(replacer.apply(match));
            pos = match.end();
            next = find(text, pos, byName);
        }
        out.append(text, pos, text.length());
        return out.toString();
    }

    /**
     * Removes every complete occurrence of the given commands.
     * @param text The text.
     * @param specs The commands to remove.
     * @return The text without the commands.
     */
    public static String remove(String text, Collection<CommandSpec> specs) {
        return rewrite(text, specs, m -> "");
    }

    /**
     * Collects every complete occurrence of the given commands, left to right.
     * @param text The text.
     * @param specs The commands to collect.
     * @return The matches.
     */
    public static List<CommandMatch> findAll(String text, Collection<CommandSpec> specs) {
        Map<String, CommandSpec> byName = index(specs);
        List<CommandMatch> matches = new ArrayList<>();
        Optional<CommandMatch> next = find(text, 0, byName);
        while (next.isPresent()) {
            matches.add(next.get());
            next = find(text, next.get().end(), byName);
        }
        return matches;
    }

    /**
     * Reads arguments at the very start of {@code text}, as used by environments like
     * {@code \begin{minipage}[t]{0.5\textwidth}}.
     * @param text The text whose start holds the arguments.
     * @param optional Whether an optional argument may come first.
     * @param count The number of mandatory arguments.
     * @return The arguments as a nameless match, or empty if they are missing.
     */
    public static Optional<CommandMatch> leadingArguments(String text, boolean optional, int count) {
        return Optional.ofNullable(readArguments(text, 0, 0, new CommandSpec("", optional, count)));
    }

    /**
     * Finds the innermost environment among the given names. The last opening marker of a handled
     * environment is tried first; its pair is the first closing marker of the same name after it.
     * An opening marker without a pair is skipped and the previous one is tried.
     * @param text The text to search.
     * @param names The handled environment names.
     * @return The innermost complete environment, or empty.
     */
    public static Optional<EnvironmentMatch> findInnermostEnvironment(String text, Set<String> names) {
        List<CommandMatch> begins = findAll(text, List.of(CommandSpec.of("begin", 1))).stream()
                .filter(m -> names.contains(m.argument(0).trim()))
                .toList();
        Map<String, CommandSpec> endSpec = index(List.of(CommandSpec.of("end", 1)));
        for (int b = begins.size() - 1; b >= 0; b--) {
            CommandMatch begin = begins.get(b);
            String name = begin.argument(0).trim();
            Optional<CommandMatch> end = find(text, begin.end(), endSpec);
            while (end.isPresent() && !end.get().argument(0).trim().equals(name)) {
                end = find(text, end.get().end(), endSpec);
            }
            if (end.isPresent()) {
                String body = text.substring(begin.end(), end.get().start());
                return Optional.of(new EnvironmentMatch(name, begin.start(), end.get().end(), body));
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the index of the bracket closing the one at {@code openIndex}, honoring nesting and escapes.
     * @param text The text.
     * @param openIndex Index of the opening bracket.
     * @param open The opening character.
     * @param close The closing character.
     * @return The index of the closing bracket, or -1 if unbalanced.
     */
    public static int findClosing(String text, int openIndex, char open, char close) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != open && c != close) continue;
            if (isEscaped(text, i)) continue;
            if (c == open) {
                depth++;
            } else if (--depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static CommandMatch readArguments(String text, int start, int nameEnd, CommandSpec spec) {
        int pos = nameEnd;
        boolean starred = false;
        if (pos < text.length() && text.charAt(pos) == '*') {
            starred = true;
            pos++;
        }
        String optional = null;
        if (spec.optionalArgument()) {
            int bracket = skipBlanks(text, pos);
            if (bracket < text.length() && text.charAt(bracket) == '[') {
                int close = findClosing(text, bracket, '[', ']');
                if (close < 0) return null;
                optional = text.substring(bracket + 1, close);
                pos = close + 1;
            }
        }
        List<String> args = new ArrayList<>(spec.argumentCount());
        for (int a = 0; a < spec.argumentCount(); a++) {
            int brace = skipBlanks(text, pos);
            if (brace >= text.length() || text.charAt(brace) != '{') return null;
            int close = findClosing(text, brace, '{', '}');
            if (close < 0) return null;
            args.add(text.substring(brace + 1, close));
            pos = close + 1;
        }
        return new CommandMatch(spec.name(), start, pos, starred, optional, args);
    }

    private static int skipBlanks(String text, int pos) {
        while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
            pos++;
        }
        return pos;
    }

    private static Map<String, CommandSpec> index(Collection<CommandSpec> specs) {
        Map<String, CommandSpec> byName = new HashMap<>();
        for (CommandSpec spec : specs) {
            byName.put(spec.name(), spec);
        }
        return byName;
    }
}
