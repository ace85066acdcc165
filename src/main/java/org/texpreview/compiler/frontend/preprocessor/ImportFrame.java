package org.texpreview.compiler.frontend.preprocessor;

import java.util.HashSet;
import java.util.Set;

/**
 * The files already being expanded on the current inclusion branch.
 * <p>
 * Frames are immutable: {@link #with(String)} returns a new frame for a child expansion, so
 * sibling inclusions never see each other's files. A file included from two siblings (diamond)
 * is expanded twice, while a file including one of its ancestors is reported as a cycle.
 *
 * @param visited The names on the path from the entry file to the current file.
 */
public record ImportFrame(Set<String> visited) {

    public ImportFrame {
        visited = Set.copyOf(visited);
    }

    /**
     * @return A frame without any visited file.
     */
    public static ImportFrame empty() {
        return new ImportFrame(Set.of());
    }

    /**
     * @param entryFileName The name of the entry file.
     * @return A frame containing only the entry file.
     */
    public static ImportFrame root(String entryFileName) {
        return new ImportFrame(Set.of(entryFileName));
    }

    /**
     * @param name A file name.
     * @return {@code true} if the file is an ancestor on the current branch.
     */
    public boolean contains(String name) {
        return visited.contains(name);
    }

    /**
     * @param name The file about to be expanded.
     * @return A new frame for the child expansion.
     */
    public ImportFrame with(String name) {
        Set<String> next = new HashSet<>(visited);
        next.add(name);
        return new ImportFrame(next);
    }

    /**
     * @return The number of files on the current branch.
     */
    public int depth() {
        return visited.size();
    }
}
