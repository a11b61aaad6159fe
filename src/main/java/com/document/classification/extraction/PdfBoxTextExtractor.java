package com.document.classification.extraction;

import com.document.classification.core.model.Document;
import com.document.classification.core.model.DocumentMetadata;
import com.document.classification.exception.ExtractionException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Calendar;

/**
 * PDF extractor built on Apache PDFBox.
 * Reads the body text (optionally only the first pages) and the info dictionary.
 * Scanned PDFs without a text layer yield empty text, not an error.
 */
public class PdfBoxTextExtractor implements TextExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);

    private final int maxPages;

    /**
     * Creates an extractor reading every page.
     */
    public PdfBoxTextExtractor() {
        this(0);
    }

    /**
     * @param maxPages number of leading pages to read, 0 for all pages
     */
    public PdfBoxTextExtractor(int maxPages) {
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must be >= 0");
        }
        this.maxPages = maxPages;
    }

    @Override
    public boolean supports(Path path) {
        return TextExtractor.hasExtension(path, "pdf");
    }

    @Override
    public Document extract(Path path, Path sourceRoot) {
        if (!Files.isRegularFile(path)) {
            throw new ExtractionException(path, "File not found: " + path);
        }
        try (PDDocument pdf = Loader.loadPDF(path.toFile())) {
            if (pdf.isEncrypted() && !pdf.getCurrentAccessPermission().canExtractContent()) {
                throw new ExtractionException(path, "PDF is encrypted and does not permit text extraction");
            }
            int pageCount = pdf.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            if (maxPages > 0) {
                stripper.setStartPage(1);
                stripper.setEndPage(Math.min(maxPages, Math.max(pageCount, 1)));
            }
            String text = stripper.getText(pdf);

            DocumentMetadata metadata = readMetadata(pdf.getDocumentInformation(), path, sourceRoot, pageCount);
            log.debug("pdf.extracted path={} pages={} chars={}", path, pageCount, text.length());
            return new Document(path, text, metadata);
        } catch (InvalidPasswordException e) {
            throw new ExtractionException(path, "PDF is password protected", e);
        } catch (IOException e) {
            throw new ExtractionException(path, "Failed to read PDF: " + e.getMessage(), e);
        }
    }

    private DocumentMetadata readMetadata(PDDocumentInformation info, Path path, Path sourceRoot, int pageCount)
            throws IOException {
        long size = Files.size(path);
        String fileName = path.getFileName().toString();
        String relativePath = TextExtractor.relativePath(path, sourceRoot);
        if (info == null) {
            return new DocumentMetadata(fileName, relativePath, size, pageCount, null, null, null, null, null);
        }
        return new DocumentMetadata(
                fileName,
                relativePath,
                size,
                pageCount,
                toInstant(info.getCreationDate()),
                info.getTitle(),
                info.getAuthor(),
                info.getSubject(),
                info.getKeywords()
        );
    }

    private static Instant toInstant(Calendar calendar) {
        return calendar != null ? calendar.toInstant() : null;
    }
}
