package com.example.research.model;

import java.nio.file.Path;

/**
 * Files produced by a complete pipeline run.
 *
 * @param runDir          run directory holding every artifact
 * @param prompt          persisted prompt
 * @param report          raw report text
 * @param citations       citations artifact
 * @param claims          claims artifact
 * @param verification    verification artifact
 * @param finalReport     compiled report
 * @param pipelineTimings per-stage timings
 */
public record RunArtifacts(
        Path runDir,
        Path prompt,
        Path report,
        Path citations,
        Path claims,
        Path verification,
        Path finalReport,
        PipelineTimings pipelineTimings
) {
}
