package com.example.research.orchestrator;

import com.example.research.agent.ResearchAgent;
import com.example.research.model.CitationReport;
import com.example.research.model.ClaimReport;
import com.example.research.model.PipelineTimings;
import com.example.research.model.RunArtifacts;
import com.example.research.model.StageResult;
import com.example.research.model.VerificationReport;
import com.example.research.service.ArtifactStore;
import com.example.research.service.CitationExtractor;
import com.example.research.service.ClaimExtractor;
import com.example.research.service.ReportCompiler;
import com.example.research.service.VerificationCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Research verification pipeline orchestrator.
 * Pipeline:
 * 1. Persist the prompt
 * 2. Report generation (LLM), persisted
 * 3. Citation + claim extraction from the persisted report
 * 4. Source verification from the persisted claims
 * 5. Final report compilation from the run directory
 * <p>
 * Each stage reads the previous stage's files rather than in-memory results, so
 * {@link #extract}, {@link #verify} and {@link #compile} can be run on their own.
 */
@Service
public class ResearchPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResearchPipelineOrchestrator.class);

    private final ResearchAgent researchAgent;
    private final CitationExtractor citationExtractor;
    private final ClaimExtractor claimExtractor;
    private final VerificationCoordinator verificationCoordinator;
    private final ReportCompiler reportCompiler;
    private final ArtifactStore artifactStore;

    public ResearchPipelineOrchestrator(ResearchAgent researchAgent,
                                        CitationExtractor citationExtractor,
                                        ClaimExtractor claimExtractor,
                                        VerificationCoordinator verificationCoordinator,
                                        ReportCompiler reportCompiler,
                                        ArtifactStore artifactStore) {
        this.researchAgent = researchAgent;
        this.citationExtractor = citationExtractor;
        this.claimExtractor = claimExtractor;
        this.verificationCoordinator = verificationCoordinator;
        this.reportCompiler = reportCompiler;
        this.artifactStore = artifactStore;
    }

    public RunArtifacts run(String prompt) {
        long t0 = System.nanoTime();
        log.info("═══════════════════════════════════════════════");
        log.info("Starting research pipeline");
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Prompt ──
        Path runDir = artifactStore.createRunDirectory();
        Path promptFile = artifactStore.writeText(runDir.resolve(ArtifactStore.PROMPT), prompt);
        log.info("[1/5] Prompt persisted: {}", promptFile);

        // ── Step 2: Report generation ──
        log.info("[2/5] Generating report...");
        String reportText = researchAgent.writeReport(prompt);
        Path reportFile = artifactStore.writeText(runDir.resolve(ArtifactStore.REPORT), reportText);
        log.info("[2/5] Report persisted: {} ({} characters)", reportFile, reportText.length());
        long t1 = System.nanoTime();

        // ── Step 3: Extraction ──
        log.info("[3/5] Extracting citations and claims...");
        StageResult extraction = extract(reportFile);
        log.info("[3/5] Extraction completed: {}", extraction.counts());
        long t2 = System.nanoTime();

        // ── Step 4: Verification ──
        log.info("[4/5] Verifying claims against cited sources...");
        StageResult verification = verify(runDir.resolve(ArtifactStore.CLAIMS));
        log.info("[4/5] Verification completed: {}", verification.counts());
        long t3 = System.nanoTime();

        // ── Step 5: Compilation ──
        log.info("[5/5] Compiling final report...");
        StageResult compilation = compile(runDir);
        log.info("[5/5] Final report: {}", compilation.artifacts().get(0));
        long t4 = System.nanoTime();

        PipelineTimings timings = new PipelineTimings(
                seconds(t1 - t0), seconds(t2 - t1), seconds(t3 - t2), seconds(t4 - t3));
        log.info("═══════════════════════════════════════════════");
        log.info("Pipeline completed in {}s: {}", "%.2f".formatted(timings.totalSeconds()), runDir);
        log.info("═══════════════════════════════════════════════");

        return new RunArtifacts(
                runDir,
                promptFile,
                reportFile,
                runDir.resolve(ArtifactStore.CITATIONS),
                runDir.resolve(ArtifactStore.CLAIMS),
                runDir.resolve(ArtifactStore.VERIFICATION),
                compilation.artifacts().get(0),
                timings);
    }

    /**
     * Extracts citations and claims from a persisted report. Both artifacts are written
     * next to the report.
     */
    public StageResult extract(Path reportFile) {
        String reportText = artifactStore.readText(reportFile);
        Path dir = parentOf(reportFile);

        CitationReport citations = citationExtractor.extract(reportText);
        ClaimReport claims = claimExtractor.extract(reportText);
        Path citationsFile = artifactStore.writeJson(dir.resolve(ArtifactStore.CITATIONS), citations);
        Path claimsFile = artifactStore.writeJson(dir.resolve(ArtifactStore.CLAIMS), claims);

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("citations", citations.totalCitations());
        counts.put("unique_domains", citations.uniqueDomains());
        counts.put("claims", claims.totalClaims());
        counts.put("by_confidence", claims.byConfidence());
        return new StageResult("extract", List.of(citationsFile, claimsFile), counts);
    }

    /**
     * Verifies a persisted claims artifact. The verification artifact is written next to it.
     */
    public StageResult verify(Path claimsFile) {
        ClaimReport claims = artifactStore.readJson(claimsFile, ClaimReport.class);
        VerificationReport verification = verificationCoordinator.verify(claims);
        Path verificationFile = artifactStore.writeJson(
                parentOf(claimsFile).resolve(ArtifactStore.VERIFICATION), verification);

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("claims", verification.results().size());
        counts.put("summary", verification.summary());
        return new StageResult("verify", List.of(verificationFile), counts);
    }

    /**
     * Compiles the final report of a run directory.
     */
    public StageResult compile(Path runDir) {
        String compiled = reportCompiler.compile(runDir);
        Path finalFile = artifactStore.writeText(runDir.resolve(ArtifactStore.FINAL_REPORT), compiled);
        return new StageResult("compile", List.of(finalFile), Map.of("characters", compiled.length()));
    }

    private static Path parentOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }

    private static double seconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
