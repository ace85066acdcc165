package org.texpreview.compiler.api;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the binary assets (images) available to one compile pass.
 */
public interface IAssetResolver {

    /**
     * Looks up the data reference of an asset, typically a {@code data:} URI.
     * @param name The asset key exactly as registered.
     * @return The data reference, or empty if the key is unknown.
     */
    Optional<String> lookup(String name);

    /**
     * @return All registered asset keys.
     */
    Set<String> keys();
}
