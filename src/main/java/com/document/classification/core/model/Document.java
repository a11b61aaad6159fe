package com.document.classification.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A document after text extraction. Identity is the source path.
 * Immutable; consumed read-only by the rule engine and the semantic classifier.
 */
public record Document(Path sourcePath, String text, DocumentMetadata metadata) {

    public Document {
        Objects.requireNonNull(sourcePath, "sourcePath is required");
        Objects.requireNonNull(metadata, "metadata is required");
        text = text != null ? text : "";
    }

    public boolean hasText() {
        return !text.isBlank();
    }

    @Override
    public String toString() {
        return "Document{" +
                "sourcePath=" + sourcePath +
                ", textLength=" + text.length() +
                ", pages=" + metadata.pageCount() +
                '}';
    }
}
