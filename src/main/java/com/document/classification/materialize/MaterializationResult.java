package com.document.classification.materialize;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of placing documents into category folders.
 *
 * @param placed  source to target for every copied document
 * @param skipped documents left out because they failed
 * @param errors  copy failures; the remaining documents are still placed
 */
public record MaterializationResult(List<Placement> placed, List<Path> skipped, List<PlacementError> errors) {

    public MaterializationResult {
        placed = placed != null ? List.copyOf(placed) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public record Placement(Path source, Path target, String category) {}

    public record PlacementError(Path source, String message) {}

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "MaterializationResult{placed=" + placed.size() +
                ", skipped=" + skipped.size() +
                ", errors=" + errors.size() + '}';
    }
}
