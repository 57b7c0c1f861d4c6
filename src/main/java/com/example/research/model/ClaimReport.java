package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Contents of the {@code claims.json} artifact.
 *
 * @param claims       claims in document order
 * @param totalClaims  number of claims
 * @param byConfidence claim count per confidence level, every level listed
 * @param byType       claim count per claim type, every type listed
 */
@JsonPropertyOrder({"claims", "total_claims", "by_confidence", "by_type"})
public record ClaimReport(
        List<Claim> claims,
        @JsonProperty("total_claims") int totalClaims,
        @JsonProperty("by_confidence") Map<String, Integer> byConfidence,
        @JsonProperty("by_type") Map<String, Integer> byType
) {
    public ClaimReport {
        claims = claims != null ? List.copyOf(claims) : List.of();
        byConfidence = byConfidence != null ? byConfidence : Map.of();
        byType = byType != null ? byType : Map.of();
    }

    public static ClaimReport empty() {
        return new ClaimReport(List.of(), 0, Map.of(), Map.of());
    }
}
