package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Contents of the {@code citations.json} artifact.
 *
 * @param citations      every citation in document order
 * @param totalCitations number of citations
 * @param uniqueDomains  number of distinct hosts in {@code byDomain}
 * @param bySection      citation count per section, in order of first appearance
 * @param byDomain       citation count per host, in order of first appearance
 */
@JsonPropertyOrder({"citations", "total_citations", "unique_domains", "by_section", "by_domain"})
public record CitationReport(
        List<Citation> citations,
        @JsonProperty("total_citations") int totalCitations,
        @JsonProperty("unique_domains") int uniqueDomains,
        @JsonProperty("by_section") Map<String, Integer> bySection,
        @JsonProperty("by_domain") Map<String, Integer> byDomain
) {
    public CitationReport {
        citations = citations != null ? List.copyOf(citations) : List.of();
        bySection = bySection != null ? bySection : Map.of();
        byDomain = byDomain != null ? byDomain : Map.of();
    }

    public static CitationReport empty() {
        return new CitationReport(List.of(), 0, 0, Map.of(), Map.of());
    }
}
