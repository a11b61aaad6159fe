package com.document.classification.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates the documents under a source directory.
 * Results are sorted by path so that runs over the same tree are reproducible.
 */
public class DocumentDiscovery {
    private static final Logger log = LoggerFactory.getLogger(DocumentDiscovery.class);

    private final Set<String> extensions;

    /**
     * @param extensions supported extensions without the dot, matched case-insensitively
     */
    public DocumentDiscovery(Set<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one extension is required");
        }
        this.extensions = extensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Recursively lists supported regular files under the root.
     *
     * @throws IllegalArgumentException when the root is not a directory
     * @throws UncheckedIOException     when the tree cannot be walked
     */
    public List<Path> discover(Path root) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Source directory not found: " + root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> documents = walk
                    .filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted()
                    .collect(Collectors.toList());
            log.info("discovery.completed root={} documents={}", root, documents.size());
            return documents;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
    }

    public boolean isSupported(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1));
    }

    public Set<String> getExtensions() {
        return extensions;
    }
}
