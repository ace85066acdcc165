package org.texpreview.project;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texpreview.compiler.api.IAssetResolver;
import org.texpreview.compiler.api.IFileResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An immutable in-memory copy of a project's files, keyed by basename.
 * <p>
 * A compile pass reads a snapshot taken before it starts, so edits made while it runs are only
 * seen by the next pass. When two files share a basename the one with the lexicographically
 * smaller relative path wins.
 */
public final class ProjectSnapshot {

    private static final Logger log = LoggerFactory.getLogger(ProjectSnapshot.class);

    private final Map<String, SourceFile> files;

    private ProjectSnapshot(Map<String, SourceFile> files) {
        this.files = Collections.unmodifiableMap(files);
    }

    /**
     * Creates a snapshot from explicit entries. Later entries with an already used name are ignored.
     * @param entries The files.
     * @return The snapshot.
     */
    public static ProjectSnapshot of(Collection<SourceFile> entries) {
        Map<String, SourceFile> byName = new TreeMap<>();
        for (SourceFile file : entries) {
            if (byName.putIfAbsent(file.name(), file) != null) {
                log.warn("Duplicate file name '{}' in project, keeping the first occurrence", file.name());
            }
        }
        return new ProjectSnapshot(byName);
    }

    /**
     * @param entries The files.
     * @return The snapshot.
     */
    public static ProjectSnapshot of(SourceFile... entries) {
        return of(List.of(entries));
    }

    /**
     * Reads every regular file below a directory. Hidden files and directories are skipped.
     * @param root The project directory.
     * @return The snapshot.
     * @throws IOException if the directory cannot be walked or a file cannot be read.
     */
    public static ProjectSnapshot fromDirectory(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root.toAbsolutePath());
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.filter(Files::isRegularFile)
                    .filter(p -> !isHidden(root.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
        List<SourceFile> entries = new ArrayList<>(paths.size());
        for (Path path : paths) {
            entries.add(SourceFile.of(path.getFileName().toString(), Files.readAllBytes(path)));
        }
        log.debug("Loaded {} file(s) from {}", entries.size(), root.toAbsolutePath());
        return of(entries);
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) return true;
        }
        return false;
    }

    /**
     * @param name A basename.
     * @return The file, or empty.
     */
    public Optional<SourceFile> get(String name) {
        return Optional.ofNullable(files.get(name));
    }

    /**
     * @return All files in name order.
     */
    public Collection<SourceFile> files() {
        return files.values();
    }

    /**
     * @return The number of files.
     */
    public int size() {
        return files.size();
    }

    /**
     * @return A resolver over the markup files of this snapshot.
     */
    public IFileResolver fileResolver() {
        Set<String> names = namesOf(SourceKind.TEX);
        return new IFileResolver() {
            @Override
            public Optional<String> lookup(String name) {
                return names.contains(name) ? Optional.of(files.get(name).text()) : Optional.empty();
            }

            @Override
            public Set<String> names() {
                return names;
            }
        };
    }

    /**
     * @return A resolver over the images of this snapshot, answering with data URIs.
     */
    public IAssetResolver assetResolver() {
        Set<String> keys = namesOf(SourceKind.IMAGE);
        return new IAssetResolver() {
            @Override
            public Optional<String> lookup(String name) {
                return keys.contains(name) ? Optional.of(files.get(name).dataUri()) : Optional.empty();
            }

            @Override
            public Set<String> keys() {
                return keys;
            }
        };
    }

    private Set<String> namesOf(SourceKind kind) {
        return files.values().stream()
                .filter(f -> f.kind() == kind)
                .map(SourceFile::name)
                .collect(Collectors.toUnmodifiableSet());
    }
}
