package org.texpreview.compiler.frontend.structure;

import java.util.Arrays;
import java.util.Optional;

/**
 * The structural heading commands and how they render.
 */
public enum HeadingLevel {
    /** Top level, numbered {@code 1}, {@code 2}, ... */
    CHAPTER("chapter", "h1", true),
    /** Mid level, numbered {@code 1.1} below a chapter or {@code 1} without one. */
    SECTION("section", "h2", true),
    /** Low level, numbered {@code 1.1.1} below a chapter or {@code 1.1} without one. */
    SUBSECTION("subsection", "h3", true),
    /** Rendered but never numbered. */
    SUBSUBSECTION("subsubsection", "h4", false);

    private final String command;
    private final String htmlTag;
    private final boolean numbered;

    HeadingLevel(String command, String htmlTag, boolean numbered) {
        this.command = command;
        this.htmlTag = htmlTag;
        this.numbered = numbered;
    }

    public String command() { return command; }

    public String htmlTag() { return htmlTag; }

    public boolean isNumbered() { return numbered; }

    /**
     * @param command A command name without backslash.
     * @return The level introduced by that command, or empty.
     */
    public static Optional<HeadingLevel> byCommand(String command) {
        return Arrays.stream(values()).filter(l -> l.command.equals(command)).findFirst();
    }
}
