package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of the {@code verification.json} artifact.
 *
 * @param summary status value to count, for the statuses that occur
 * @param results one result per claim, positionally aligned with the claims artifact
 */
@JsonPropertyOrder({"summary", "results"})
public record VerificationReport(
        Map<String, Integer> summary,
        List<VerificationResult> results
) {
    public VerificationReport {
        summary = summary != null ? summary : Map.of();
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static VerificationReport empty() {
        return new VerificationReport(Map.of(), List.of());
    }

    /** Builds the report, counting statuses in a single pass in order of first occurrence. */
    public static VerificationReport of(List<VerificationResult> results) {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (VerificationResult r : results) {
            summary.merge(r.status().value(), 1, Integer::sum);
        }
        return new VerificationReport(summary, results);
    }

    public int count(VerificationStatus status) {
        return summary.getOrDefault(status.value(), 0);
    }

    /** Claims whose source supports them fully or partially. */
    public int verifiedCount() {
        return count(VerificationStatus.SUPPORTED) + count(VerificationStatus.PARTIAL);
    }
}
