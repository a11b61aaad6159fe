package com.document.classification.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DocumentDiscoveryTest {

    @TempDir
    Path tempDir;

    private void touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }

    @Test
    @DisplayName("Should find supported files recursively in sorted order")
    void testDiscover() throws IOException {
        touch("m2/b.pdf");
        touch("m1/z.TXT");
        touch("m1/a.pdf");
        touch("m1/image.png");
        touch("readme.md");

        List<Path> found = new DocumentDiscovery(Set.of("pdf", ".txt")).discover(tempDir);

        assertEquals(List.of(
                tempDir.resolve("m1/a.pdf"),
                tempDir.resolve("m1/z.TXT"),
                tempDir.resolve("m2/b.pdf")), found);
    }

    @Test
    @DisplayName("Should return an empty list for an empty directory")
    void testEmpty() {
        assertTrue(new DocumentDiscovery(Set.of("pdf")).discover(tempDir).isEmpty());
    }

    @Test
    @DisplayName("Should reject a missing root")
    void testMissingRoot() {
        assertThrows(IllegalArgumentException.class,
                () -> new DocumentDiscovery(Set.of("pdf")).discover(tempDir.resolve("absent")));
    }
}
