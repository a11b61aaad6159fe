package com.document.classification.materialize;

import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies each non-failed document to {@code <destination>/<category>/}.
 * Unclassified documents go to the {@code Unclassified} folder. An existing
 * file is never overwritten: the copy is renamed {@code name_1.ext},
 * {@code name_2.ext} and so on.
 */
public class CopyingFolderMaterializer implements FolderMaterializer {
    private static final Logger log = LoggerFactory.getLogger(CopyingFolderMaterializer.class);

    private static final int MAX_ATTEMPTS = 10_000;

    @Override
    public MaterializationResult materialize(List<Decision> decisions, Path destination) {
        List<MaterializationResult.Placement> placed = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        List<MaterializationResult.PlacementError> errors = new ArrayList<>();

        for (Decision decision : decisions) {
            if (decision.outcome() == DecisionOutcome.FAILED) {
                skipped.add(decision.sourcePath());
                continue;
            }
            try {
                Path folder = destination.resolve(decision.category());
                Files.createDirectories(folder);
                Path target = copyUnique(decision.sourcePath(), folder);
                placed.add(new MaterializationResult.Placement(decision.sourcePath(), target, decision.category()));
                log.debug("document.placed source={} target={}", decision.sourcePath(), target);
            } catch (IOException e) {
                log.error("document.place.failed source={} error={}", decision.sourcePath(), e.getMessage());
                errors.add(new MaterializationResult.PlacementError(decision.sourcePath(), e.getMessage()));
            }
        }

        MaterializationResult result = new MaterializationResult(placed, skipped, errors);
        log.info("materialize.completed destination={} placed={} skipped={} errors={}",
                destination, placed.size(), skipped.size(), errors.size());
        return result;
    }

    private Path copyUnique(Path source, Path folder) throws IOException {
        String fileName = source.getFileName().toString();
        for (int counter = 0; counter < MAX_ATTEMPTS; counter++) {
            Path target = folder.resolve(candidateName(fileName, counter));
            try {
                return Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
            } catch (FileAlreadyExistsException e) {
                log.trace("document.place.collision target={}", target);
            }
        }
        throw new IOException("No free file name for " + fileName + " in " + folder);
    }

    /**
     * {@code report.pdf} becomes {@code report_2.pdf} for counter 2; counter 0 keeps the name.
     */
    static String candidateName(String fileName, int counter) {
        if (counter == 0) {
            return fileName;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + "_" + counter;
        }
        return fileName.substring(0, dot) + "_" + counter + fileName.substring(dot);
    }
}
