package com.document.classification.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into consecutive chunks no longer than the embedding model accepts.
 *
 * <p>Chunking is deterministic: the same text always yields the same chunks.
 * A chunk ends at the last whitespace before the limit when there is one in the
 * second half of the window, otherwise it is cut at the limit. Every character
 * of the input (apart from whitespace at chunk boundaries) ends up in a chunk.</p>
 */
public class TextChunker {

    public static final int DEFAULT_MAX_CHARS = 2_000;

    private final int maxChars;

    public TextChunker() {
        this(DEFAULT_MAX_CHARS);
    }

    public TextChunker(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be > 0");
        }
        this.maxChars = maxChars;
    }

    public int getMaxChars() {
        return maxChars;
    }

    /**
     * Splits the text. Blank text yields an empty list.
     */
    public List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }
        String normalized = text.strip();
        int start = 0;
        int length = normalized.length();
        while (start < length) {
            int end = Math.min(start + maxChars, length);
            if (end < length) {
                int cut = lastWhitespace(normalized, start + maxChars / 2, end);
                if (cut > start) {
                    end = cut;
                }
            }
            String chunk = normalized.substring(start, end).strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            start = end;
            while (start < length && Character.isWhitespace(normalized.charAt(start))) {
                start++;
            }
        }
        return chunks;
    }

    private static int lastWhitespace(String text, int from, int to) {
        for (int i = to; i > from; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
