package com.document.classification.extraction;

import com.document.classification.core.model.Document;
import com.document.classification.exception.ExtractionException;

import java.nio.file.Path;
import java.util.List;

/**
 * Dispatches to the first extractor that supports the file.
 */
public class CompositeTextExtractor implements TextExtractor {

    private final List<TextExtractor> extractors;

    public CompositeTextExtractor(List<TextExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    /**
     * PDF and plain text support.
     *
     * @param maxPdfPages number of leading PDF pages to read, 0 for all
     */
    public static CompositeTextExtractor createDefault(int maxPdfPages) {
        return new CompositeTextExtractor(List.of(new PdfBoxTextExtractor(maxPdfPages), new PlainTextExtractor()));
    }

    @Override
    public boolean supports(Path path) {
        return extractors.stream().anyMatch(extractor -> extractor.supports(path));
    }

    @Override
    public Document extract(Path path, Path sourceRoot) {
        for (TextExtractor extractor : extractors) {
            if (extractor.supports(path)) {
                return extractor.extract(path, sourceRoot);
            }
        }
        throw new ExtractionException(path, "Unsupported document format: " + path.getFileName());
    }
}
