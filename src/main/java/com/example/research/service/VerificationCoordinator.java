package com.example.research.service;

import com.example.research.config.ResearchProperties;
import com.example.research.model.Claim;
import com.example.research.model.ClaimReport;
import com.example.research.model.FetchOutcome;
import com.example.research.model.SupportVerdict;
import com.example.research.model.VerificationReport;
import com.example.research.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Verifies every claim against its first citation.
 * <p>
 * All cited claims are queued on the verification executor up front. Each one takes a
 * slot of a per-batch semaphore before fetching and gives it back once its fetch and
 * support check are done, so at most {@code research.verification.concurrency} fetches
 * of a batch are in flight even on a larger executor. Results are joined in input
 * order, independent of completion order.
 */
@Service
public class VerificationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(VerificationCoordinator.class);

    static final String NO_HTTP_CLIENT = "no HTTP client available";

    private final SourceFetcher fetcher;
    private final SupportChecker supportChecker;
    private final ExecutorService verificationExecutor;
    private final int concurrency;

    public VerificationCoordinator(Optional<SourceFetcher> fetcher,
                                   SupportChecker supportChecker,
                                   ResearchProperties properties,
                                   @Qualifier("verificationExecutor") ExecutorService verificationExecutor) {
        this.fetcher = fetcher.orElse(null);
        this.supportChecker = supportChecker;
        this.verificationExecutor = verificationExecutor;
        this.concurrency = properties.verification().concurrency();
    }

    /**
     * Verifies all claims of a claims artifact.
     *
     * @param claimReport the extracted claims
     * @return one result per claim, in claim order, with a status summary
     */
    public VerificationReport verify(ClaimReport claimReport) {
        List<Claim> claims = claimReport.claims();
        log.info("VerificationCoordinator: verifying {} claims (max {} concurrent fetches)",
                claims.size(), concurrency);

        if (fetcher == null) {
            log.warn("VerificationCoordinator: no HTTP fetcher configured, all claims skipped");
            return VerificationReport.of(claims.stream()
                    .map(c -> VerificationResult.skipped(c, NO_HTTP_CLIENT))
                    .toList());
        }

        Semaphore slots = new Semaphore(concurrency);
        List<CompletableFuture<VerificationResult>> pending = new ArrayList<>(claims.size());
        for (Claim claim : claims) {
            if (claim.citations().isEmpty()) {
                pending.add(CompletableFuture.completedFuture(VerificationResult.uncited(claim)));
            } else {
                pending.add(CompletableFuture.supplyAsync(() -> verifyWithSlot(claim, slots), verificationExecutor));
            }
        }

        List<VerificationResult> results = pending.stream().map(CompletableFuture::join).toList();
        VerificationReport report = VerificationReport.of(results);
        log.info("VerificationCoordinator: completed, summary {}", report.summary());
        return report;
    }

    private VerificationResult verifyWithSlot(Claim claim, Semaphore slots) {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return VerificationResult.skipped(claim, "verification interrupted");
        }
        try {
            return verifyCited(claim);
        } finally {
            slots.release();
        }
    }

    VerificationResult verifyCited(Claim claim) {
        String url = claim.primaryCitation();
        FetchOutcome outcome = fetcher.fetch(url);
        if (outcome instanceof FetchOutcome.Failed failed) {
            log.debug("{}: {} -> {} ({})", claim.id(), url, failed.status().value(), failed.note());
            return VerificationResult.failed(claim, failed);
        }

        String body = ((FetchOutcome.Fetched) outcome).body();
        SupportVerdict verdict = supportChecker.check(claim.text(), body);
        log.debug("{}: {} -> {} ({}/{} terms)", claim.id(), url, verdict.status().value(),
                verdict.matchedTerms(), verdict.totalTerms());
        return VerificationResult.checked(claim, verdict);
    }
}
