package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Verification record for a single claim. Exactly one exists per claim.
 *
 * @param claimId     id of the verified claim
 * @param claimText   text of the verified claim
 * @param citationUrl the claim's first citation, or {@code null} when it has none
 * @param status      verification outcome
 * @param evidence    excerpt of the source around the first matched key term (at most 500 characters)
 * @param notes       human-readable reason for non-support-check outcomes
 */
@JsonPropertyOrder({"claimId", "claimText", "citationUrl", "status", "evidence", "notes"})
public record VerificationResult(
        String claimId,
        String claimText,
        String citationUrl,
        VerificationStatus status,
        String evidence,
        String notes
) {
    public static final int MAX_EVIDENCE_LENGTH = 500;

    public VerificationResult {
        evidence = evidence == null ? "" : evidence;
        notes = notes == null ? "" : notes;
    }

    public static VerificationResult skipped(Claim claim, String note) {
        return new VerificationResult(claim.id(), claim.text(), claim.primaryCitation(),
                VerificationStatus.SKIPPED, "", note);
    }

    public static VerificationResult uncited(Claim claim) {
        return new VerificationResult(claim.id(), claim.text(), null,
                VerificationStatus.NOT_FOUND, "", "No citation provided");
    }

    public static VerificationResult failed(Claim claim, FetchOutcome.Failed failure) {
        return new VerificationResult(claim.id(), claim.text(), claim.primaryCitation(),
                failure.status(), "", failure.note());
    }

    public static VerificationResult checked(Claim claim, SupportVerdict verdict) {
        String evidence = verdict.evidence();
        if (evidence.length() > MAX_EVIDENCE_LENGTH) {
            evidence = evidence.substring(0, MAX_EVIDENCE_LENGTH);
        }
        return new VerificationResult(claim.id(), claim.text(), claim.primaryCitation(),
                verdict.status(), evidence, "");
    }
}
