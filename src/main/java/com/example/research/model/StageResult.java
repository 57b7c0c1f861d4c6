package com.example.research.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a single pipeline stage, reported to the CLI and REST callers.
 *
 * @param stage     stage name (extract, verify, compile)
 * @param artifacts files the stage wrote
 * @param counts    the stage's count summary (citations found, claims found, status histogram)
 */
public record StageResult(
        String stage,
        List<Path> artifacts,
        Map<String, Object> counts
) {
    public StageResult {
        artifacts = List.copyOf(artifacts);
        counts = counts != null ? counts : Map.of();
    }
}
