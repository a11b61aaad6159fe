package com.document.classification.rules;

import com.document.classification.core.model.Document;

/**
 * The part of a document a rule is tested against.
 */
public enum RuleField {
    /** Extracted body text. */
    TEXT,

    /** File name without directories. */
    FILENAME,

    /** Title, author, subject and keywords from the document properties. */
    METADATA,

    /** Path relative to the scanned root, e.g. {@code m3/stability/report.pdf}. */
    PATH;

    /**
     * Selects the value of this field from the document. Never null.
     */
    public String select(Document document) {
        switch (this) {
            case TEXT:
                return document.text();
            case FILENAME:
                return document.metadata().fileName();
            case METADATA:
                return document.metadata().metadataText();
            case PATH:
                return document.metadata().relativePath();
            default:
                throw new IllegalStateException("Unknown rule field: " + this);
        }
    }
}
