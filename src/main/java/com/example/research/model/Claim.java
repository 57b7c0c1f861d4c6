package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One atomic, independently checkable sentence of the report.
 *
 * @param id         monotonic identifier ({@code claim_001}, {@code claim_002}, ...)
 * @param text       the trimmed sentence
 * @param section    the level-2 heading the sentence belongs to
 * @param citations  URLs appearing literally inside the sentence, in order
 * @param confidence confidence inferred from hedging and factual markers
 * @param claimType  claim type inferred from wording
 */
@JsonPropertyOrder({"id", "text", "section", "citations", "confidence", "claimType"})
public record Claim(
        String id,
        String text,
        String section,
        List<String> citations,
        Confidence confidence,
        ClaimType claimType
) {
    public Claim {
        citations = citations != null ? List.copyOf(citations) : List.of();
    }

    /** The only citation verification ever inspects, or {@code null} if the claim cites nothing. */
    public String primaryCitation() {
        return citations.isEmpty() ? null : citations.get(0);
    }
}
