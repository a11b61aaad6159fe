package com.document.classification.core.model;

/**
 * Kind of per-document error recorded on a decision.
 */
public enum ErrorKind {
    EXTRACTION,
    EMBEDDING,
    VALIDATION,
    INTERNAL
}
