package com.example.research.model;

/**
 * Per-stage timing for a pipeline run (in seconds).
 *
 * @param reportGenerationSeconds Stage 1-2: prompt persistence and report generation (LLM)
 * @param extractionSeconds       Stage 3: citation and claim extraction
 * @param verificationSeconds     Stage 4: source fetching and support checks
 * @param compilationSeconds      Stage 5: final report compilation
 */
public record PipelineTimings(
        double reportGenerationSeconds,
        double extractionSeconds,
        double verificationSeconds,
        double compilationSeconds
) {
    public double totalSeconds() {
        return reportGenerationSeconds + extractionSeconds + verificationSeconds + compilationSeconds;
    }
}
