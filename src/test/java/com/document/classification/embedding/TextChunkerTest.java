package com.document.classification.embedding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextChunkerTest {

    @Test
    @DisplayName("Should return no chunks for blank text")
    void testBlank() {
        TextChunker chunker = new TextChunker(10);
        assertTrue(chunker.chunk(null).isEmpty());
        assertTrue(chunker.chunk("   \n ").isEmpty());
    }

    @Test
    @DisplayName("Should keep short text as a single chunk")
    void testShortText() {
        assertEquals(List.of("hello world"), new TextChunker(100).chunk("  hello world  "));
    }

    @Test
    @DisplayName("Should cut at whitespace and keep every word")
    void testWhitespaceBoundaries() {
        TextChunker chunker = new TextChunker(12);
        List<String> chunks = chunker.chunk("alpha beta gamma delta epsilon");

        assertEquals(List.of("alpha beta", "gamma delta", "epsilon"), chunks);
        for (String chunk : chunks) {
            assertTrue(chunk.length() <= 12);
        }
    }

    @Test
    @DisplayName("Should hard-cut text without whitespace and drop nothing")
    void testHardCut() {
        String text = "abcdefghijklmnopqrstuvwxyz";
        List<String> chunks = new TextChunker(10).chunk(text);

        assertEquals(List.of("abcdefghij", "klmnopqrst", "uvwxyz"), chunks);
        assertEquals(text, String.join("", chunks));
    }

    @Test
    @DisplayName("Should be deterministic")
    void testDeterministic() {
        TextChunker chunker = new TextChunker(50);
        String text = "Lorem ipsum dolor sit amet, ".repeat(40);
        assertEquals(chunker.chunk(text), chunker.chunk(text));
    }

    @Test
    @DisplayName("Should reject a non-positive chunk size")
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(0));
    }
}
