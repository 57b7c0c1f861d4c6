package com.example.research.service;

import com.example.research.config.AiConfig;
import com.example.research.config.ResearchProperties;
import com.example.research.model.Claim;
import com.example.research.model.ClaimReport;
import com.example.research.model.ClaimType;
import com.example.research.model.Confidence;
import com.example.research.model.FetchOutcome;
import com.example.research.model.SupportVerdict;
import com.example.research.model.VerificationReport;
import com.example.research.model.VerificationResult;
import com.example.research.model.VerificationStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Coordinator tests with in-memory fetchers; no network access.
 */
class VerificationCoordinatorTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void uncitedClaimsAreNotFoundWithoutFetching() {
        SourceFetcher fetcher = mock(SourceFetcher.class);
        VerificationCoordinator coordinator = coordinator(fetcher, 5);

        VerificationReport report = coordinator.verify(claims(
                claim(1, "A claim sentence without any citation."),
                claim(2, "Another uncited claim sentence here.")));

        verify(fetcher, never()).fetch(anyString());
        for (VerificationResult r : report.results()) {
            assertEquals(VerificationStatus.NOT_FOUND, r.status());
            assertEquals("No citation provided", r.notes());
            assertNull(r.citationUrl());
        }
        assertEquals(Map.of("not_found", 2), report.summary());
    }

    @Test
    void onlyFirstCitationIsFetched() {
        SourceFetcher fetcher = mock(SourceFetcher.class);
        when(fetcher.fetch("https://first.example/a")).thenReturn(FetchOutcome.fetched("Acme Corp sold 500 units."));
        VerificationCoordinator coordinator = coordinator(fetcher, 5);

        VerificationReport report = coordinator.verify(claims(
                claim(1, "Acme Corp sold 500 units last quarter.", "https://first.example/a", "https://second.example/b")));

        verify(fetcher, times(1)).fetch("https://first.example/a");
        verify(fetcher, never()).fetch("https://second.example/b");
        VerificationResult result = report.results().get(0);
        assertEquals(VerificationStatus.SUPPORTED, result.status());
        assertEquals("https://first.example/a", result.citationUrl());
        assertEquals("", result.notes());
        assertFalse(result.evidence().isEmpty());
    }

    @Test
    void paywallHasNoEvidence() {
        VerificationCoordinator coordinator = coordinator(url -> FetchOutcome.paywall(), 5);

        VerificationResult result = coordinator.verify(claims(
                claim(1, "Acme Corp sold 500 units last quarter.", "https://paywalled.example/x"))).results().get(0);

        assertEquals(VerificationStatus.PAYWALL, result.status());
        assertEquals("", result.evidence());
        assertEquals("Access denied (likely paywall)", result.notes());
    }

    @Test
    void transportErrorIsInaccessibleWithTruncatedNote() {
        String longMessage = "Request timed out: " + "z".repeat(400);
        VerificationCoordinator coordinator = coordinator(url -> FetchOutcome.transportError(longMessage), 5);

        VerificationResult result = coordinator.verify(claims(
                claim(1, "Acme Corp sold 500 units last quarter.", "https://slow.example/x"))).results().get(0);

        assertEquals(VerificationStatus.INACCESSIBLE, result.status());
        assertTrue(result.notes().startsWith("Request timed out"));
        assertTrue(result.notes().length() <= 200);
    }

    @Test
    void evidenceIsTruncatedTo500Characters() {
        String source = "Acme Corp ".repeat(200);
        SupportChecker wholeSource = new SupportChecker(0.7) {
            @Override
            public SupportVerdict check(String claimText, String sourceText) {
                return new SupportVerdict(VerificationStatus.SUPPORTED, sourceText, 1, 1);
            }
        };
        VerificationCoordinator coordinator = new VerificationCoordinator(
                Optional.of(url -> FetchOutcome.fetched(source)), wholeSource, properties(5), executor);

        VerificationResult result = coordinator.verify(claims(
                claim(1, "Acme Corp is a company name here.", "https://a.example/x"))).results().get(0);

        assertEquals(500, result.evidence().length());
    }

    @Test
    void missingFetcherSkipsEveryClaim() {
        VerificationCoordinator coordinator = new VerificationCoordinator(Optional.empty(),
                new SupportChecker(0.7), properties(5), executor);

        VerificationReport report = coordinator.verify(claims(
                claim(1, "Acme Corp sold 500 units last quarter.", "https://a.example/x"),
                claim(2, "A claim sentence without any citation.")));

        assertEquals(Map.of("skipped", 2), report.summary());
        report.results().forEach(r -> assertEquals(VerificationCoordinator.NO_HTTP_CLIENT, r.notes()));
    }

    @Test
    void resultsStayAlignedWithInputsUnderRandomLatency() {
        SourceFetcher fetcher = url -> {
            sleepQuietly(ThreadLocalRandom.current().nextInt(1, 30));
            return FetchOutcome.fetched("Page for " + url);
        };
        List<Claim> input = new ArrayList<>();
        for (int i = 1; i <= 30; i++) {
            input.add(i % 4 == 0
                    ? claim(i, "Claim number " + i + " has no citation at all.")
                    : claim(i, "Claim number " + i + " cites a page.", "https://site.example/" + i));
        }

        VerificationReport report = coordinator(fetcher, 4).verify(claims(input.toArray(Claim[]::new)));

        assertEquals(input.size(), report.results().size());
        for (int i = 0; i < input.size(); i++) {
            assertEquals(input.get(i).id(), report.results().get(i).claimId());
            assertEquals(input.get(i).primaryCitation(), report.results().get(i).citationUrl());
        }
        int total = report.summary().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(input.size(), total);
    }

    @Test
    void inFlightFetchesNeverExceedCap() {
        int cap = 3;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        SourceFetcher fetcher = url -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            sleepQuietly(ThreadLocalRandom.current().nextInt(5, 25));
            inFlight.decrementAndGet();
            return FetchOutcome.httpStatus(404);
        };
        List<Claim> input = new ArrayList<>();
        for (int i = 1; i <= 40; i++) {
            input.add(claim(i, "Claim number " + i + " cites a page.", "https://site.example/" + i));
        }

        VerificationReport report = coordinator(fetcher, cap).verify(claims(input.toArray(Claim[]::new)));

        assertTrue(peak.get() <= cap, "peak in-flight fetches was " + peak.get());
        assertTrue(peak.get() >= 1);
        assertEquals(Map.of("inaccessible", 40), report.summary());
        assertEquals("HTTP 404", report.results().get(0).notes());
    }

    @Test
    void pageThatGrowsWhenLowerCasedDoesNotAbortBatch() {
        SourceFetcher fetcher = url -> url.endsWith("/dotted")
                ? FetchOutcome.fetched("\u0130".repeat(300) + " Solar power")
                : FetchOutcome.fetched("Acme Corp sold 500 units.");

        VerificationReport report = coordinator(fetcher, 2).verify(claims(
                claim(1, "Acme Corp sold 500 units last quarter.", "https://plain.example/a"),
                claim(2, "Solar adoption grew quickly last year.", "https://dotted.example/dotted")));

        assertEquals(2, report.results().size());
        assertEquals(VerificationStatus.SUPPORTED, report.results().get(0).status());
        assertEquals(VerificationStatus.SUPPORTED, report.results().get(1).status());
        assertTrue(report.results().get(1).evidence().endsWith(" Solar power"));
    }

    @Test
    void verificationPoolNeverGrowsPastCap() {
        int cap = 5;
        ResearchProperties properties = properties(cap);
        ExecutorService pool = new AiConfig().verificationExecutor(properties);
        try {
            SourceFetcher fetcher = url -> {
                sleepQuietly(2);
                return FetchOutcome.httpStatus(404);
            };
            List<Claim> input = new ArrayList<>();
            for (int i = 1; i <= 200; i++) {
                input.add(claim(i, "Claim number " + i + " cites a page.", "https://site.example/" + i));
            }
            VerificationCoordinator coordinator = new VerificationCoordinator(Optional.of(fetcher),
                    new SupportChecker(0.7), properties, pool);

            VerificationReport report = coordinator.verify(claims(input.toArray(Claim[]::new)));

            assertEquals(200, report.results().size());
            int largest = ((ThreadPoolExecutor) pool).getLargestPoolSize();
            assertTrue(largest <= cap, "largest pool size was " + largest);
        } finally {
            pool.shutdownNow();
        }
    }

    private VerificationCoordinator coordinator(SourceFetcher fetcher, int concurrency) {
        return new VerificationCoordinator(Optional.of(fetcher), new SupportChecker(0.7),
                properties(concurrency), executor);
    }

    private static ResearchProperties properties(int concurrency) {
        return new ResearchProperties("runs", null,
                new ResearchProperties.Verification(concurrency, null, null, null, null));
    }

    private static Claim claim(int n, String text, String... citations) {
        return new Claim("claim_%03d".formatted(n), text, "Findings", List.of(citations),
                Confidence.LOW, ClaimType.FACTUAL);
    }

    private static ClaimReport claims(Claim... claims) {
        return new ClaimReport(List.of(claims), claims.length, Map.of(), Map.of());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
