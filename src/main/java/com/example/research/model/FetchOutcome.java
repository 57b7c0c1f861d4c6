package com.example.research.model;

/**
 * Result of fetching a cited source. Fetch failures are values, not exceptions,
 * so a failing source only ever affects its own claim.
 */
public sealed interface FetchOutcome permits FetchOutcome.Fetched, FetchOutcome.Failed {

    /** HTTP 200 with the final (post-redirect) body. */
    record Fetched(String body) implements FetchOutcome {
        public Fetched {
            body = body == null ? "" : body;
        }
    }

    /**
     * Terminal failure for this run.
     *
     * @param status {@link VerificationStatus#INACCESSIBLE} or {@link VerificationStatus#PAYWALL}
     * @param note   short reason ("HTTP 404", transport error message, ...)
     */
    record Failed(VerificationStatus status, String note) implements FetchOutcome {
    }

    static FetchOutcome fetched(String body) {
        return new Fetched(body);
    }

    static FetchOutcome paywall() {
        return new Failed(VerificationStatus.PAYWALL, "Access denied (likely paywall)");
    }

    static FetchOutcome httpStatus(int status) {
        return new Failed(VerificationStatus.INACCESSIBLE, "HTTP " + status);
    }

    static FetchOutcome transportError(String message) {
        String note = message == null ? "Unknown error" : message;
        if (note.length() > 200) {
            note = note.substring(0, 200);
        }
        return new Failed(VerificationStatus.INACCESSIBLE, note);
    }
}
