package com.document.classification.extraction;

import com.document.classification.core.model.Document;
import com.document.classification.exception.ExtractionException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Turns a file into a {@link Document}: plain text plus lightweight metadata.
 */
public interface TextExtractor {

    /**
     * Returns true if this extractor handles the file, judged by its name.
     */
    boolean supports(Path path);

    /**
     * Extracts the document.
     *
     * @param path       the file to read
     * @param sourceRoot the scanned root, used to compute the relative path
     * @throws ExtractionException when no text can be obtained
     */
    Document extract(Path path, Path sourceRoot);

    /**
     * Path of the file relative to the root, with '/' separators.
     */
    static String relativePath(Path path, Path sourceRoot) {
        Path relative = path;
        if (sourceRoot != null) {
            Path normalizedRoot = sourceRoot.toAbsolutePath().normalize();
            Path normalizedPath = path.toAbsolutePath().normalize();
            if (normalizedPath.startsWith(normalizedRoot)) {
                relative = normalizedRoot.relativize(normalizedPath);
            }
        }
        return relative.toString().replace('\\', '/');
    }

    static boolean hasExtension(Path path, String extension) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith("." + extension);
    }
}
