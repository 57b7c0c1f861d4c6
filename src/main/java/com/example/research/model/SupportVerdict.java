package com.example.research.model;

/**
 * Lexical support verdict for a claim against one source text.
 *
 * @param status       {@code SUPPORTED}, {@code PARTIAL} or {@code NOT_FOUND}
 * @param evidence     excerpt around the first matched term, empty if nothing matched
 * @param matchedTerms number of key terms found in the source
 * @param totalTerms   number of key terms extracted from the claim
 */
public record SupportVerdict(
        VerificationStatus status,
        String evidence,
        int matchedTerms,
        int totalTerms
) {
}
