package com.document.classification.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lightweight metadata captured alongside the extracted text.
 *
 * @param fileName     file name without directories
 * @param relativePath path relative to the scanned root, using '/' separators
 * @param sizeBytes    file size on disk
 * @param pageCount    number of pages, 0 when not applicable
 * @param createdAt    creation date from the document itself, if available
 * @param title        document title, may be null
 * @param author       document author, may be null
 * @param subject      document subject, may be null
 * @param keywords     document keywords, may be null
 */
public record DocumentMetadata(
        String fileName,
        String relativePath,
        long sizeBytes,
        int pageCount,
        Instant createdAt,
        String title,
        String author,
        String subject,
        String keywords
) {
    public DocumentMetadata {
        Objects.requireNonNull(fileName, "fileName is required");
        relativePath = relativePath != null ? relativePath : fileName;
    }

    /**
     * Creates metadata carrying only file-system information.
     */
    public static DocumentMetadata ofFile(String fileName, String relativePath, long sizeBytes) {
        return new DocumentMetadata(fileName, relativePath, sizeBytes, 0, null, null, null, null, null);
    }

    /**
     * Joins the descriptive fields (title, author, subject, keywords) into one
     * searchable string. Empty when none are present.
     */
    public String metadataText() {
        List<String> parts = new ArrayList<>(4);
        for (String value : new String[]{title, author, subject, keywords}) {
            if (value != null && !value.isBlank()) {
                parts.add(value.trim());
            }
        }
        return String.join("\n", parts);
    }
}
