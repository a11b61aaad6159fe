package com.document.classification.rules;

/**
 * How a rule pattern is interpreted.
 */
public enum RuleType {
    /** Literal phrase, matched as a case-insensitive substring. */
    KEYWORD,

    /** Java regular expression, matched case-insensitively with {@code find()}. */
    REGEX
}
