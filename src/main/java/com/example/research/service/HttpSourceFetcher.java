package com.example.research.service;

import com.example.research.config.ResearchProperties;
import com.example.research.model.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link SourceFetcher} backed by Spring's {@link RestClient} on the JDK HTTP client.
 * <p>
 * Classification:
 * - 200: body handed back for the support check
 * - 403: {@code paywall}
 * - other status: {@code inaccessible} ("HTTP 404", ...)
 * - transport, timeout, DNS or malformed URL: {@code inaccessible} with the error message
 * <p>
 * Redirects are followed; a failed attempt is never retried. Text bodies without a
 * declared charset are decoded as UTF-8.
 */
@Service
@ConditionalOnProperty(prefix = "research.verification", name = "http-enabled",
        havingValue = "true", matchIfMissing = true)
public class HttpSourceFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpSourceFetcher.class);

    private final RestClient restClient;

    public HttpSourceFetcher(ResearchProperties properties) {
        ResearchProperties.Verification settings = properties.verification();
        Duration timeout = settings.timeout();

        HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);

        this.restClient = RestClient.builder()
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.USER_AGENT, settings.userAgent())
                .messageConverters(converters -> converters.add(0, new StringHttpMessageConverter(StandardCharsets.UTF_8)))
                .build();
    }

    @Override
    public FetchOutcome fetch(String url) {
        try {
            FetchOutcome outcome = restClient.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        if (status == 200) {
                            String body = response.bodyTo(String.class);
                            return FetchOutcome.fetched(body);
                        }
                        if (status == 403) {
                            return FetchOutcome.paywall();
                        }
                        return FetchOutcome.httpStatus(status);
                    });
            log.debug("Fetched {} -> {}", url, outcome.getClass().getSimpleName());
            return outcome;
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Fetch failed for {}: {}", url, e.getMessage());
            return FetchOutcome.transportError(describe(e));
        }
    }

    private static String describe(Exception e) {
        if (e.getMessage() != null) return e.getMessage();
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.toString();
    }
}
