package com.example.research.service;

import com.example.research.model.Citation;
import com.example.research.model.CitationReport;
import com.example.research.model.ReportLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Finds every URL occurrence in a report and records where it was cited.
 * <p>
 * Occurrences are not deduplicated: each keeps its own line, section and sentence.
 */
@Service
public class CitationExtractor {

    private static final Logger log = LoggerFactory.getLogger(CitationExtractor.class);

    /** Characters of context kept on each side of a URL. */
    private static final int CONTEXT_RADIUS = 50;

    /** One-shot helper for callers that do not hold a bean. */
    public static CitationReport citationsOf(String reportText) {
        return new CitationExtractor().extract(reportText);
    }

    public CitationReport extract(String reportText) {
        List<Citation> citations = new ArrayList<>();
        Map<String, Integer> bySection = new LinkedHashMap<>();
        Map<String, Integer> byDomain = new LinkedHashMap<>();

        for (ReportLine line : TextSegmenter.segment(reportText)) {
            Matcher m = TextSegmenter.URL_PATTERN.matcher(line.text());
            while (m.find()) {
                String url = m.group();
                citations.add(new Citation(
                        url,
                        line.section(),
                        TextSegmenter.window(line.text(), m.start(), m.end(), CONTEXT_RADIUS),
                        line.lineNumber(),
                        TextSegmenter.containingSentence(line.text(), m.start(), m.end())));

                bySection.merge(line.section(), 1, Integer::sum);
                String domain = TextSegmenter.domainOf(url);
                if (domain != null) {
                    byDomain.merge(domain, 1, Integer::sum);
                }
            }
        }

        log.info("CitationExtractor: {} citations across {} domains", citations.size(), byDomain.size());
        return new CitationReport(citations, citations.size(), byDomain.size(), bySection, byDomain);
    }
}
