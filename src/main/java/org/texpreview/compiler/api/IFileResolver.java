package org.texpreview.compiler.api;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the text files available to one compile pass, keyed by basename.
 * <p>
 * The caller guarantees name uniqueness within the scope handed to a pass and must not expose
 * mutations made while the pass is running.
 */
public interface IFileResolver {

    /**
     * Looks up the raw content of a file.
     * @param name The basename of the file, including its extension.
     * @return The content, or empty if no such file exists.
     */
    Optional<String> lookup(String name);

    /**
     * @return All file names this resolver can answer for.
     */
    Set<String> names();
}
