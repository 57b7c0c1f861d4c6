package com.example.research.service;

import com.example.research.model.SupportVerdict;
import com.example.research.model.VerificationStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupportCheckerTest {

    private static final String CLAIM = "Alpha Beta reported 120 units and 340 units in Gamma.";

    private final SupportChecker checker = new SupportChecker(0.7);

    @Test
    void keyTermsAreNumbersQuotesThenCapitalisedPhrases() {
        List<String> terms = SupportChecker.extractKeyTerms(
                "Solar adoption grew 42% in 2023 according to \"Global Energy Review\" data.");

        assertEquals(List.of("42%", "2023", "Global Energy Review", "Solar", "Global Energy Review"), terms);
    }

    @Test
    void shortTermsAreDropped() {
        assertEquals(List.of(), SupportChecker.extractKeyTerms("US grew 5% in Q1 to \"ok\" levels."));
    }

    @Test
    void noKeyTermsMeansNotFound() {
        SupportVerdict verdict = checker.check("prices went up a lot this year.", "prices went up a lot");

        assertEquals(VerificationStatus.NOT_FOUND, verdict.status());
        assertEquals("", verdict.evidence());
        assertEquals(0, verdict.totalTerms());
    }

    @Test
    void allTermsFoundIsSupported() {
        SupportVerdict verdict = checker.check(CLAIM,
                "In GAMMA, alpha beta shipped 120 units, then 340 units.");

        assertEquals(VerificationStatus.SUPPORTED, verdict.status());
        assertEquals(4, verdict.matchedTerms());
        assertEquals(4, verdict.totalTerms());
    }

    @Test
    void someTermsFoundIsPartial() {
        SupportVerdict verdict = checker.check(CLAIM, "Alpha Beta shipped 120 units.");

        assertEquals(VerificationStatus.PARTIAL, verdict.status());
        assertEquals(2, verdict.matchedTerms());
    }

    @Test
    void ratioBoundaryCountsAsSupported() {
        SupportVerdict verdict = new SupportChecker(0.5).check(CLAIM, "Alpha Beta shipped 120 units.");

        assertEquals(VerificationStatus.SUPPORTED, verdict.status());
    }

    @Test
    void sevenOfTenTermsMeetsDefaultRatio() {
        String claim = "the counts were 101, 202, 303, 404, 505, 606, 707, 808, 909 and 1010 overall.";
        assertEquals(10, SupportChecker.extractKeyTerms(claim).size());

        SupportVerdict seven = checker.check(claim, "Tallies: 101 202 303 404 505 606 707.");
        SupportVerdict six = checker.check(claim, "Tallies: 101 202 303 404 505 606.");

        assertEquals(7, seven.matchedTerms());
        assertEquals(VerificationStatus.SUPPORTED, seven.status());
        assertEquals(VerificationStatus.PARTIAL, six.status());
    }

    @Test
    void sourceThatGrowsWhenLowerCasedKeepsEvidenceAligned() {
        // U+0130 lower-cases to two chars, which must not shift match offsets
        String source = "\u0130".repeat(300) + " Solar power";

        SupportVerdict verdict = checker.check("Solar adoption grew quickly last year.", source);

        assertEquals(VerificationStatus.SUPPORTED, verdict.status());
        assertEquals("\u0130".repeat(99) + " Solar power", verdict.evidence());
    }

    @Test
    void matchingIgnoresUnicodeCase() {
        SupportVerdict verdict = checker.check("Reports describe \"über alles\" growth.", "REPORTS SAY ÜBER ALLES.");

        assertEquals(VerificationStatus.SUPPORTED, verdict.status());
        assertEquals(2, verdict.matchedTerms());
    }

    @Test
    void nothingFoundIsNotFound() {
        SupportVerdict verdict = checker.check(CLAIM, "An unrelated page about weather.");

        assertEquals(VerificationStatus.NOT_FOUND, verdict.status());
        assertEquals("", verdict.evidence());
    }

    @Test
    void evidenceIsWindowAroundFirstMatchedTerm() {
        String source = "x".repeat(300) + "Alpha Beta" + "y".repeat(300);

        SupportVerdict verdict = checker.check(CLAIM, source);

        assertEquals(100 + "Alpha Beta".length() + 100, verdict.evidence().length());
        assertEquals("x".repeat(100) + "Alpha Beta" + "y".repeat(100), verdict.evidence());
    }

    @Test
    void neverReportsContradiction() {
        SupportVerdict verdict = checker.check("Revenue fell 40% at Acme.", "Acme revenue rose 40%, it did not fall.");

        assertNotEquals(VerificationStatus.CONTRADICTED, verdict.status());
    }
}
