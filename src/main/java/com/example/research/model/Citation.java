package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single URL occurrence found in the report text.
 * <p>
 * Citations are never deduplicated: a URL cited twice yields two records,
 * each keeping its own position.
 *
 * @param url                the matched URL token
 * @param section            the level-2 heading the line belongs to
 * @param context            up to 50 characters either side of the match, clipped to the line
 * @param lineNumber         1-based line number of the match
 * @param containingSentence the sentence around the match within its line
 */
@JsonPropertyOrder({"url", "section", "context", "lineNumber", "containingSentence"})
public record Citation(
        String url,
        String section,
        String context,
        int lineNumber,
        String containingSentence
) {
}
