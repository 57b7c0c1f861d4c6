package com.example.research.service;

import com.example.research.model.FetchOutcome;

/**
 * Fetches the text behind a citation URL.
 * <p>
 * Implementations never throw for per-URL problems: every transport error and
 * non-200 status is returned as a {@link FetchOutcome.Failed}.
 */
@FunctionalInterface
public interface SourceFetcher {

    FetchOutcome fetch(String url);
}
