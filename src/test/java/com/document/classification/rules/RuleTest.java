package com.document.classification.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RuleTest {

    @Nested
    @DisplayName("Keyword rules")
    class KeywordRules {

        @Test
        @DisplayName("Should match case-insensitively")
        void testCaseInsensitive() {
            Rule rule = Rule.keyword("r1", "Invoice", 0.5);
            assertTrue(rule.matches("please pay this INVOICE today"));
            assertTrue(rule.matches("invoice"));
            assertFalse(rule.matches("receipt"));
        }

        @Test
        @DisplayName("Should match multi-word keywords across any whitespace")
        void testWhitespaceTolerant() {
            Rule rule = Rule.keyword("r1", "amount   due", 0.5);
            assertTrue(rule.matches("Total amount\ndue: 100 EUR"));
            assertTrue(rule.matches("AMOUNT DUE"));
            assertFalse(rule.matches("amountdue"));
        }

        @Test
        @DisplayName("Should treat regex metacharacters in keywords literally")
        void testKeywordIsLiteral() {
            Rule rule = Rule.keyword("r1", "a.b", 0.5);
            assertTrue(rule.matches("see a.b here"));
            assertFalse(rule.matches("see axb here"));
        }

        @Test
        @DisplayName("Should never match null or empty values")
        void testEmptyValue() {
            Rule rule = Rule.keyword("r1", "invoice", 0.5);
            assertFalse(rule.matches(null));
            assertFalse(rule.matches(""));
        }
    }

    @Nested
    @DisplayName("Regex rules")
    class RegexRules {

        @Test
        @DisplayName("Should find the pattern anywhere in the value")
        void testFind() {
            Rule rule = Rule.regex("inv-number", "INV-\\d{4,}", 0.5);
            assertTrue(rule.matches("Reference inv-20240 attached"));
            assertFalse(rule.matches("Reference INV-12"));
        }

        @Test
        @DisplayName("Should reject an invalid regular expression")
        void testInvalidRegex() {
            assertThrows(IllegalArgumentException.class, () -> Rule.regex("bad", "([a-z", 0.5));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @DisplayName("Should reject non-positive or non-finite weights")
        @ValueSource(doubles = {0.0, -0.1, Double.NaN, Double.POSITIVE_INFINITY})
        void testInvalidWeight(double weight) {
            assertThrows(IllegalArgumentException.class, () -> Rule.keyword("r1", "invoice", weight));
        }

        @ParameterizedTest
        @DisplayName("Should reject blank patterns")
        @ValueSource(strings = {"", "   "})
        void testBlankPattern(String pattern) {
            assertThrows(IllegalArgumentException.class, () -> Rule.keyword("r1", pattern, 0.5));
        }

        @Test
        @DisplayName("Should require an id")
        void testMissingId() {
            assertThrows(NullPointerException.class,
                    () -> Rule.builder().pattern("invoice").weight(0.5).build());
        }
    }

    @Nested
    @DisplayName("Identity")
    class Identity {

        @Test
        @DisplayName("Should be equal when pattern, type and field match, whatever the id and weight")
        void testEqualityIgnoresIdAndWeight() {
            Rule a = Rule.keyword("a", "Amount  Due", 0.2);
            Rule b = Rule.keyword("b", "amount due", 0.7);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertEquals(a.identityKey(), b.identityKey());
        }

        @Test
        @DisplayName("Should differ when the field differs")
        void testFieldDistinguishes() {
            Rule text = Rule.keyword("a", "invoice", 0.2);
            Rule fileName = Rule.builder().id("b").type(RuleType.KEYWORD).field(RuleField.FILENAME)
                    .pattern("invoice").weight(0.2).build();
            assertNotEquals(text, fileName);
        }

        @Test
        @DisplayName("Should differ between keyword and regex with the same text")
        void testTypeDistinguishes() {
            assertNotEquals(Rule.keyword("a", "invoice", 0.2), Rule.regex("b", "invoice", 0.2));
        }
    }
}
