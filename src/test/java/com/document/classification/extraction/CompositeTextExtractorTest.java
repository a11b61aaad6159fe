package com.document.classification.extraction;

import com.document.classification.core.model.Document;
import com.document.classification.exception.ExtractionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CompositeTextExtractorTest {

    @TempDir
    Path tempDir;

    private final CompositeTextExtractor extractor = CompositeTextExtractor.createDefault(0);

    @Test
    @DisplayName("Should read UTF-8 text files")
    void testPlainText() throws IOException {
        Path file = tempDir.resolve("notes/contract.txt");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "Contrat de vente – clause 4");

        Document document = extractor.extract(file, tempDir);

        assertEquals("Contrat de vente – clause 4", document.text());
        assertEquals("notes/contract.txt", document.metadata().relativePath());
        assertEquals(0, document.metadata().pageCount());
    }

    @Test
    @DisplayName("Should dispatch pdf files to PDFBox")
    void testPdf() throws IOException {
        Path file = tempDir.resolve("doc.pdf");
        PdfBoxTextExtractorTest.writePdf(file, null, "stability study results");

        assertTrue(extractor.extract(file, tempDir).text().contains("stability study"));
    }

    @Test
    @DisplayName("Should reject invalid UTF-8 text")
    void testInvalidUtf8() throws IOException {
        Path file = tempDir.resolve("latin1.txt");
        Files.write(file, new byte[]{(byte) 0xC3, (byte) 0x28, (byte) 0xFF});

        assertThrows(ExtractionException.class, () -> extractor.extract(file, tempDir));
    }

    @Test
    @DisplayName("Should reject unsupported formats")
    void testUnsupported() {
        Path file = tempDir.resolve("image.png");
        assertFalse(extractor.supports(file));
        assertThrows(ExtractionException.class, () -> extractor.extract(file, tempDir));
    }
}
