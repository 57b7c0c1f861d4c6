package com.example.research.service;

import com.example.research.model.Claim;
import com.example.research.model.ClaimReport;
import com.example.research.model.ClaimType;
import com.example.research.model.Confidence;
import com.example.research.model.ReportLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a report into atomic claims and classifies each one.
 * <p>
 * Every sentence of at least {@value #MIN_CLAIM_LENGTH} characters outside headings is a
 * claim. A claim's citations are the URLs inside its own sentence; they are not looked
 * up in the citation artifact.
 */
@Service
public class ClaimExtractor {

    private static final Logger log = LoggerFactory.getLogger(ClaimExtractor.class);

    static final int MIN_CLAIM_LENGTH = 20;

    /** One-shot helper for callers that do not hold a bean. */
    public static ClaimReport claimsOf(String reportText) {
        return new ClaimExtractor().extract(reportText);
    }

    public ClaimReport extract(String reportText) {
        List<Claim> claims = new ArrayList<>();
        Map<String, Integer> byConfidence = new LinkedHashMap<>();
        for (Confidence c : Confidence.values()) byConfidence.put(c.value(), 0);
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (ClaimType t : ClaimType.values()) byType.put(t.value(), 0);

        int nextId = 1;
        for (ReportLine line : TextSegmenter.segment(reportText)) {
            if (line.isBlank() || line.isHeading()) continue;

            for (String sentence : TextSegmenter.splitSentences(line.text())) {
                if (sentence.length() < MIN_CLAIM_LENGTH) continue;

                Confidence confidence = ClaimClassifier.confidence(sentence);
                ClaimType type = ClaimClassifier.claimType(sentence);
                claims.add(new Claim(
                        "claim_%03d".formatted(nextId++),
                        sentence,
                        line.section(),
                        TextSegmenter.findUrls(sentence),
                        confidence,
                        type));
                byConfidence.merge(confidence.value(), 1, Integer::sum);
                byType.merge(type.value(), 1, Integer::sum);
            }
        }

        log.info("ClaimExtractor: {} claims (confidence {}, type {})", claims.size(), byConfidence, byType);
        return new ClaimReport(claims, claims.size(), byConfidence, byType);
    }
}
