package com.example.research.service;

import com.example.research.model.Claim;
import com.example.research.model.ClaimReport;
import com.example.research.model.ClaimType;
import com.example.research.model.Confidence;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClaimExtractorTest {

    private final ClaimExtractor extractor = new ClaimExtractor();

    @Test
    void solarScenario() {
        ClaimReport report = extractor.extract(
                "## Findings\nSolar adoption grew 42% in 2023 according to a report (https://example.com/a).\n");

        assertEquals(1, report.totalClaims());
        Claim claim = report.claims().get(0);
        assertEquals("claim_001", claim.id());
        assertEquals("Findings", claim.section());
        assertEquals(Confidence.HIGH, claim.confidence());
        assertEquals(ClaimType.FACTUAL, claim.claimType());
        assertEquals(List.of("https://example.com/a"), claim.citations());
    }

    @Test
    void headingsBlankLinesAndShortSentencesAreNotClaims() {
        String text = """
                # Title that is long enough to be a claim
                ## Section heading that is also long enough

                Too short. This sentence is comfortably long enough.
                   # Indented heading text that is long enough
                """;

        ClaimReport report = extractor.extract(text);

        assertEquals(1, report.totalClaims());
        assertEquals("This sentence is comfortably long enough.", report.claims().get(0).text());
        assertEquals("Section heading that is also long enough", report.claims().get(0).section());
    }

    @Test
    void idsAreMonotonicAcrossLinesAndSections() {
        String text = """
                The first claim sentence is here. The second claim sentence is here.
                ## Next
                The third claim sentence is here!
                """;

        List<String> ids = extractor.extract(text).claims().stream().map(Claim::id).toList();

        assertEquals(List.of("claim_001", "claim_002", "claim_003"), ids);
    }

    @Test
    void claimCountEqualsLongSentenceCount() {
        String text = """
                ## Overview
                Wind capacity doubled in 2021 (https://wind.example/r). Costs fell. Storage is improving fast!
                Is grid storage ready for the peak? Maybe not.

                ## Outlook
                Demand will rise 8% according to the agency. Some sources disagree strongly.
                """;

        int expected = 0;
        for (String line : text.split("\n")) {
            if (line.isBlank() || line.strip().startsWith("#")) continue;
            expected += (int) Arrays.stream(line.strip().split("(?<=[.!?])\\s+"))
                    .map(String::strip)
                    .filter(s -> s.length() >= 20)
                    .count();
        }

        assertEquals(expected, extractor.extract(text).claims().size());
        assertEquals(5, expected);
    }

    @Test
    void histogramsListEveryBucket() {
        ClaimReport report = extractor.extract("Experts believe costs might decline by 2030.");

        assertEquals(Map.of("high", 0, "medium", 0, "low", 0, "uncertain", 1), report.byConfidence());
        assertEquals(Map.of("factual", 1, "prediction", 0, "opinion", 0, "definition", 0), report.byType());
        assertEquals(List.of("high", "medium", "low", "uncertain"), List.copyOf(report.byConfidence().keySet()));
    }

    @Test
    void citationsAreComputedPerSentence() {
        ClaimReport report = extractor.extract(
                "First source is https://a.example/1 right here. Second cites https://b.example/2 and https://c.example/3 too.");

        assertEquals(List.of("https://a.example/1"), report.claims().get(0).citations());
        assertEquals(List.of("https://b.example/2", "https://c.example/3"), report.claims().get(1).citations());
    }

    @Test
    void extractionIsIdempotent() {
        String text = """
                ## A
                Battery prices fell 89% in 2020 according to BNEF (https://bnef.example/x).
                Hydrogen is defined as a flexible carrier for industry.
                """;

        assertEquals(extractor.extract(text), extractor.extract(text));
        assertEquals(extractor.extract(text), ClaimExtractor.claimsOf(text));
    }
}
