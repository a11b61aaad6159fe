package com.document.classification.exception;

/**
 * Thrown when an embedding vector cannot be computed for a document.
 */
public class EmbeddingException extends ClassificationException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
