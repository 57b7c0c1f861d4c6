package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of verifying one claim against its first citation.
 * <p>
 * {@link #CONTRADICTED} is reserved: a lexical support check cannot detect
 * contradiction, so nothing in the pipeline assigns it.
 */
public enum VerificationStatus {
    SUPPORTED("supported", "[VERIFIED]"),
    PARTIAL("partial", "[PARTIAL]"),
    NOT_FOUND("not_found", "[UNVERIFIED]"),
    CONTRADICTED("contradicted", "[DISPUTED]"),
    INACCESSIBLE("inaccessible", "[SOURCE N/A]"),
    PAYWALL("paywall", "[PAYWALL]"),
    SKIPPED("skipped", "[SKIPPED]");

    private final String value;
    private final String badge;

    VerificationStatus(String value, String badge) {
        this.value = value;
        this.badge = badge;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Short bracketed tag used in the compiled report. */
    public String badge() {
        return badge;
    }

    /**
     * Lenient lookup used when reading artifacts.
     *
     * @return the matching status, or {@code null} for values this version does not know
     */
    @JsonCreator
    public static VerificationStatus fromValue(String value) {
        if (value == null) return null;
        for (VerificationStatus s : values()) {
            if (s.value.equals(value)) return s;
        }
        return null;
    }

    /** Badge for a possibly unknown status; unknown statuses get an empty badge. */
    public static String badgeOf(VerificationStatus status) {
        return status != null ? status.badge : "";
    }
}
