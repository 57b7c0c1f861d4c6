package com.example.research.service;

import com.example.research.model.CitationReport;
import com.example.research.model.ClaimReport;
import com.example.research.model.VerificationReport;
import com.example.research.model.VerificationResult;
import com.example.research.model.VerificationStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Compiles the final annotated report of a run directory.
 * <p>
 * Structure:
 * 1. Header (timestamp, claim totals, verified count, status summary)
 * 2. Original report body, unchanged
 * 3. Verification Notes (one badge line per result, in result order)
 * <p>
 * Only {@code report.md} is required; missing citation, claim and verification
 * artifacts count as empty.
 */
@Service
public class ReportCompiler {

    private static final Logger log = LoggerFactory.getLogger(ReportCompiler.class);

    private static final int NOTE_TEXT_LENGTH = 100;

    private final ArtifactStore artifactStore;
    private final ObjectMapper objectMapper;

    public ReportCompiler(ArtifactStore artifactStore, ObjectMapper objectMapper) {
        this.artifactStore = artifactStore;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the artifacts of {@code runDir} and renders the final document.
     *
     * @throws ArtifactNotFoundException if the run directory has no report
     * @throws CorruptArtifactException  if an artifact that exists cannot be parsed
     */
    public String compile(Path runDir) {
        if (!Files.isDirectory(runDir)) {
            throw new ArtifactNotFoundException(runDir);
        }
        String report = artifactStore.readText(runDir.resolve(ArtifactStore.REPORT));
        Path citationsFile = runDir.resolve(ArtifactStore.CITATIONS);
        CitationReport citations = Files.exists(citationsFile)
                ? artifactStore.readJson(citationsFile, CitationReport.class)
                : null;
        ClaimReport claims = artifactStore.readJsonOrDefault(
                runDir.resolve(ArtifactStore.CLAIMS), ClaimReport.class, ClaimReport::empty);
        VerificationReport verification = artifactStore.readJsonOrDefault(
                runDir.resolve(ArtifactStore.VERIFICATION), VerificationReport.class, VerificationReport::empty);

        String compiled = render(report, citations, claims, verification, Instant.now());
        log.info("ReportCompiler: compiled {} ({} claims, {} verified)",
                runDir, claims.totalClaims(), verification.verifiedCount());
        return compiled;
    }

    /**
     * Renders the final document from already loaded artifacts.
     *
     * @param citations may be {@code null} when no citation artifact exists
     */
    public String render(String report, CitationReport citations, ClaimReport claims,
                         VerificationReport verification, Instant generatedAt) {
        StringBuilder out = new StringBuilder();
        out.append("# Verified Research Report\n\n");
        out.append("> Generated: ").append(generatedAt).append('\n');
        out.append("> Total claims: ").append(claims.totalClaims()).append('\n');
        out.append("> Verified claims: ").append(verification.verifiedCount()).append('\n');
        out.append("> Verification summary: ").append(toJson(verification)).append('\n');
        if (citations != null) {
            out.append("> Citations: ").append(citations.totalCitations())
                    .append(" across ").append(citations.uniqueDomains()).append(" domains\n");
        }
        out.append("\n---\n\n");
        out.append(report);
        if (!report.endsWith("\n")) out.append('\n');
        out.append("\n---\n\n");
        out.append("## Verification Notes\n\n");
        for (VerificationResult result : verification.results()) {
            out.append(noteLine(result)).append('\n');
        }
        return out.toString();
    }

    static String noteLine(VerificationResult result) {
        String text = result.claimText() != null ? result.claimText() : "";
        if (text.length() > NOTE_TEXT_LENGTH) {
            text = text.substring(0, NOTE_TEXT_LENGTH);
        }
        return "- **%s** %s: %s...".formatted(result.claimId(), VerificationStatus.badgeOf(result.status()), text);
    }

    private String toJson(VerificationReport verification) {
        try {
            return objectMapper.writeValueAsString(verification.summary());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize verification summary", e);
        }
    }
}
