package com.example.research.service;

import com.example.research.config.ResearchProperties;
import com.example.research.model.SupportVerdict;
import com.example.research.model.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical support check: does the source text mention the claim's key terms?
 * <p>
 * Approach:
 * - Extract key terms from the claim (numbers, quoted phrases, capitalised phrases)
 * - Search each term case-insensitively in the source
 * - {@code supported} when the matched share reaches the support ratio, {@code partial}
 *   when at least one term matched, {@code not_found} otherwise
 * <p>
 * No entailment is attempted, so {@code contradicted} is never produced.
 */
@Service
public class SupportChecker {

    private static final Logger log = LoggerFactory.getLogger(SupportChecker.class);

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?%?");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern CAPITALIZED_PHRASE = Pattern.compile("[A-Z][a-z]+(?: [A-Z][a-z]+)*");

    /** Terms of this length or shorter are too unspecific to count. */
    private static final int MIN_TERM_LENGTH_EXCLUSIVE = 2;

    /** Characters of source kept on each side of the first hit. */
    private static final int EXCERPT_RADIUS = 100;

    private final double supportRatio;

    @Autowired
    public SupportChecker(ResearchProperties properties) {
        this(properties.verification().supportRatio());
    }

    public SupportChecker(double supportRatio) {
        this.supportRatio = supportRatio;
    }

    /**
     * Compares a claim with the text of its cited source.
     *
     * @param claimText  the claim sentence
     * @param sourceText the fetched source body
     * @return the verdict with the excerpt around the first matched term
     */
    public SupportVerdict check(String claimText, String sourceText) {
        List<String> terms = extractKeyTerms(claimText);
        if (terms.isEmpty()) {
            return new SupportVerdict(VerificationStatus.NOT_FOUND, "", 0, 0);
        }

        String source = sourceText == null ? "" : sourceText;
        int matched = 0;
        String evidence = "";
        for (String term : terms) {
            // matched on the original text so offsets stay valid for the excerpt
            Matcher m = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(source);
            if (!m.find()) continue;
            if (matched == 0) {
                evidence = TextSegmenter.window(source, m.start(), m.end(), EXCERPT_RADIUS);
            }
            matched++;
        }

        VerificationStatus status;
        if (matched == 0) {
            status = VerificationStatus.NOT_FOUND;
        } else if ((double) matched / terms.size() >= supportRatio) {
            status = VerificationStatus.SUPPORTED;
        } else {
            status = VerificationStatus.PARTIAL;
        }
        log.debug("SupportChecker: {}/{} key terms matched -> {}", matched, terms.size(), status.value());
        return new SupportVerdict(status, evidence, matched, terms.size());
    }

    /**
     * Key terms of a claim: numbers (optionally decimal and/or percent), double-quoted
     * phrases without their quotes, and capitalised word sequences, in that order.
     * Terms of two characters or fewer are dropped; duplicates are kept.
     */
    public static List<String> extractKeyTerms(String claimText) {
        List<String> terms = new ArrayList<>();
        collect(NUMBER.matcher(claimText), 0, terms);
        collect(QUOTED.matcher(claimText), 1, terms);
        collect(CAPITALIZED_PHRASE.matcher(claimText), 0, terms);
        terms.removeIf(t -> t.length() <= MIN_TERM_LENGTH_EXCLUSIVE);
        return terms;
    }

    private static void collect(Matcher m, int group, List<String> into) {
        while (m.find()) {
            into.add(m.group(group));
        }
    }
}
