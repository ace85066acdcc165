package org.texpreview.compiler.backend.asset;

import org.texpreview.compiler.api.IAssetResolver;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The image names known to one compile pass and their data references.
 * <p>
 * Built once per pass from the full key set of an {@link IAssetResolver}. Keys are kept in sorted
 * order so the containment fallback of {@link #resolve(String)} is deterministic.
 */
public final class AssetBinding {

    private final TreeMap<String, String> entries;
    private final List<String> extensions;

    private AssetBinding(TreeMap<String, String> entries, List<String> extensions) {
        this.entries = entries;
        this.extensions = List.copyOf(extensions);
    }

    /**
     * Snapshots every key of a resolver.
     * @param resolver The asset resolver.
     * @param extensions The raster extensions tried when a name has no exact match.
     * @return The binding.
     */
    public static AssetBinding from(IAssetResolver resolver, List<String> extensions) {
        TreeMap<String, String> entries = new TreeMap<>();
        for (String key : resolver.keys()) {
            resolver.lookup(key).ifPresent(ref -> entries.put(key, ref));
        }
        return new AssetBinding(entries, extensions);
    }

    /**
     * @return A binding without any image.
     */
    public static AssetBinding empty() {
        return new AssetBinding(new TreeMap<>(), List.of());
    }

    /**
     * Finds the data reference of an image name: the exact key first, then the name with each
     * raster extension, then the first key in sorted order that contains the name.
     * @param name The basename referenced by the document.
     * @return The data reference, or empty.
     */
    public Optional<String> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String exact = entries.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (String extension : extensions) {
            String withExtension = entries.get(name + extension);
            if (withExtension != null) {
                return Optional.of(withExtension);
            }
        }
        return entries.entrySet().stream()
                .filter(e -> e.getKey().contains(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * @return The bound keys in sorted order.
     */
    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
