package com.example.research.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the research verification pipeline.
 * Passed explicitly to the components that need it; nothing reads ambient state.
 *
 * @param runsDir      root directory under which each run gets its own directory
 * @param model        report generation settings
 * @param verification source verification settings
 */
@ConfigurationProperties(prefix = "research")
public record ResearchProperties(
        String runsDir,
        Model model,
        Verification verification
) {

    public ResearchProperties {
        if (runsDir == null || runsDir.isBlank()) runsDir = "runs";
        if (model == null) model = new Model(false);
        if (verification == null) verification = Verification.defaults();
    }

    public static ResearchProperties defaults() {
        return new ResearchProperties(null, null, null);
    }

    /**
     * @param streaming consume the report as streamed chunks instead of a single response
     */
    public record Model(boolean streaming) {}

    /**
     * Source verification settings.
     *
     * @param concurrency  maximum simultaneous in-flight fetches (default 5)
     * @param timeout      per-fetch timeout (default 10s)
     * @param supportRatio share of key terms that must match for {@code supported} (default 0.7)
     * @param httpEnabled  when false no HTTP fetcher is created and every claim is {@code skipped}
     * @param userAgent    User-Agent header sent with each fetch
     */
    public record Verification(
            Integer concurrency,
            Duration timeout,
            Double supportRatio,
            Boolean httpEnabled,
            String userAgent
    ) {
        public Verification {
            if (concurrency == null || concurrency < 1) concurrency = 5;
            if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(10);
            if (supportRatio == null || supportRatio <= 0.0 || supportRatio > 1.0) supportRatio = 0.7;
            if (httpEnabled == null) httpEnabled = Boolean.TRUE;
            if (userAgent == null || userAgent.isBlank()) userAgent = "ResearchVerifier/1.0";
        }

        public static Verification defaults() {
            return new Verification(null, null, null, null, null);
        }
    }
}
