package com.document.classification.exception;

import java.nio.file.Path;

/**
 * Thrown when text could not be obtained from a document
 * (corrupt file, encrypted PDF, unsupported format, I/O failure).
 */
public class ExtractionException extends ClassificationException {

    private final Path sourcePath;

    public ExtractionException(Path sourcePath, String message) {
        super(message);
        this.sourcePath = sourcePath;
    }

    public ExtractionException(Path sourcePath, String message, Throwable cause) {
        super(message, cause);
        this.sourcePath = sourcePath;
    }

    public Path getSourcePath() {
        return sourcePath;
    }
}
