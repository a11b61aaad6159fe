package com.document.classification.extraction;

import com.document.classification.core.model.Document;
import com.document.classification.core.model.DocumentMetadata;
import com.document.classification.exception.ExtractionException;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads UTF-8 text files ({@code .txt}).
 */
public class PlainTextExtractor implements TextExtractor {

    @Override
    public boolean supports(Path path) {
        return TextExtractor.hasExtension(path, "txt");
    }

    @Override
    public Document extract(Path path, Path sourceRoot) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            DocumentMetadata metadata = DocumentMetadata.ofFile(
                    path.getFileName().toString(), TextExtractor.relativePath(path, sourceRoot), Files.size(path));
            return new Document(path, text, metadata);
        } catch (CharacterCodingException e) {
            throw new ExtractionException(path, "File is not valid UTF-8 text", e);
        } catch (IOException e) {
            throw new ExtractionException(path, "Failed to read text file: " + e.getMessage(), e);
        }
    }
}
