package com.document.classification.materialize;

import com.document.classification.core.model.Decision;

import java.nio.file.Path;
import java.util.List;

/**
 * Places classified documents into per-category folders.
 * Classification itself never touches the filesystem; this runs afterwards.
 */
public interface FolderMaterializer {

    MaterializationResult materialize(List<Decision> decisions, Path destination);
}
