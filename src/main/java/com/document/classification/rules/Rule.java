package com.document.classification.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A weighted pattern belonging to one category.
 *
 * <p>Rules compare equal when they test the same pattern against the same field
 * in the same way, regardless of id or weight. The rule engine relies on this
 * to count duplicated rules once.</p>
 */
public final class Rule {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final String id;
    private final RuleType type;
    private final RuleField field;
    private final String pattern;
    private final double weight;
    private final Pattern compiled;
    private final String identityKey;

    private Rule(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.field = builder.field;
        this.pattern = builder.pattern;
        this.weight = builder.weight;
        if (type == RuleType.KEYWORD) {
            String normalized = normalizeKeyword(pattern);
            this.compiled = Pattern.compile(Pattern.quote(normalized).replace(" ", "\\E\\s+\\Q"), FLAGS);
            this.identityKey = type + ":" + field + ":" + normalized;
        } else {
            this.compiled = Pattern.compile(pattern, FLAGS);
            this.identityKey = type + ":" + field + ":" + pattern;
        }
    }

    public String getId() {
        return id;
    }

    public RuleType getType() {
        return type;
    }

    public RuleField getField() {
        return field;
    }

    public String getPattern() {
        return pattern;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * Key identifying what this rule tests, independent of id and weight.
     */
    public String identityKey() {
        return identityKey;
    }

    /**
     * Tests the rule against a field value. Null or empty values never match.
     */
    public boolean matches(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return compiled.matcher(value).find();
    }

    static String normalizeKeyword(String keyword) {
        return keyword.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rule that = (Rule) o;
        return identityKey.equals(that.identityKey);
    }

    @Override
    public int hashCode() {
        return identityKey.hashCode();
    }

    @Override
    public String toString() {
        return "Rule{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", field=" + field +
                ", pattern='" + pattern + '\'' +
                ", weight=" + weight +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a keyword rule on the body text.
     */
    public static Rule keyword(String id, String keyword, double weight) {
        return builder().id(id).type(RuleType.KEYWORD).field(RuleField.TEXT).pattern(keyword).weight(weight).build();
    }

    /**
     * Shorthand for a regular expression rule on the body text.
     */
    public static Rule regex(String id, String regex, double weight) {
        return builder().id(id).type(RuleType.REGEX).field(RuleField.TEXT).pattern(regex).weight(weight).build();
    }

    public static class Builder {
        private String id;
        private RuleType type = RuleType.KEYWORD;
        private RuleField field = RuleField.TEXT;
        private String pattern;
        private double weight = Double.NaN;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(RuleType type) {
            this.type = type;
            return this;
        }

        public Builder field(RuleField field) {
            this.field = field;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        /**
         * @throws IllegalArgumentException on a blank pattern, a non-positive weight or an invalid regex
         */
        public Rule build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(field, "field is required");
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("Rule '" + id + "' has an empty pattern");
            }
            if (!Double.isFinite(weight) || weight <= 0.0) {
                throw new IllegalArgumentException("Rule '" + id + "' must have a positive weight, got " + weight);
            }
            return new Rule(this);
        }
    }
}
