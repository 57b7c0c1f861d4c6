package com.example.research.agent;

import com.example.research.config.ResearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Produces the research report for a prompt.
 * <p>
 * Uses the research client (Anthropic) with fallback to OpenAI. In streaming mode the
 * chunks are concatenated; the rest of the pipeline only sees the final text.
 */
@Service
public class ResearchAgent {

    private static final Logger log = LoggerFactory.getLogger(ResearchAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are a meticulous research analyst. Write a research report in markdown
            that answers the user's question.

            STRUCTURE:
            - Start with a one-paragraph summary.
            - Organise the body into sections with level-2 headings ("## Heading").
            - Close with a "## Sources" section listing every URL you cited.

            CLAIMS AND CITATIONS (CRITICAL):
            - Write one verifiable statement per sentence.
            - Put the source URL in parentheses right inside the sentence it supports,
              e.g. "Output grew 12% in 2023 (https://example.org/report)."
            - Cite only URLs you are confident exist. DO NOT invent sources.
            - Keep exact figures, dates and names as they appear in the source.
            - Mark statements you cannot support with a source with [UNCERTAIN].
            """;

    private final ChatClient researchChatClient;
    private final ChatClient fallbackChatClient;
    private final boolean streaming;

    public ResearchAgent(@Qualifier("researchChatClient") ChatClient researchChatClient,
                         @Qualifier("fallbackChatClient") ChatClient fallbackChatClient,
                         ResearchProperties properties) {
        this.researchChatClient = researchChatClient;
        this.fallbackChatClient = fallbackChatClient;
        this.streaming = properties.model().streaming();
    }

    /**
     * Generates the report text for a prompt.
     *
     * @param prompt the research question
     * @return the complete markdown report
     * @throws RuntimeException if both clients fail or return nothing
     */
    public String writeReport(String prompt) {
        log.info("ResearchAgent: generating report ({} characters of prompt, streaming={})",
                prompt.length(), streaming);
        try {
            String report = generate(researchChatClient, prompt);
            if (report != null && !report.isBlank()) {
                log.info("ResearchAgent: report generated, {} characters", report.length());
                return report;
            }
            log.warn("Research client returned empty response, trying fallback...");
        } catch (Exception e) {
            log.warn("Research client failed ({}), trying fallback...", e.getMessage());
        }

        try {
            String report = generate(fallbackChatClient, prompt);
            if (report == null || report.isBlank()) {
                throw new IllegalStateException("Empty report from fallback client");
            }
            log.info("ResearchAgent: report generated by fallback, {} characters", report.length());
            return report;
        } catch (Exception e) {
            log.error("ResearchAgent: report generation failed", e);
            throw new RuntimeException("Error generating research report: " + e.getMessage(), e);
        }
    }

    private String generate(ChatClient chatClient, String prompt) {
        ChatClient.ChatClientRequestSpec request = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(prompt);
        if (streaming) {
            return request.stream()
                    .content()
                    .collect(Collectors.joining())
                    .block();
        }
        return request.call().content();
    }
}
