package com.example.research.config;

import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ChatClients for report generation, executors, and the shared ObjectMapper.
 * <p>
 * - researchChatClient (Anthropic): writes the research report
 * - fallbackChatClient (OpenAI): used once when the research client fails
 */
@Configuration
public class AiConfig {

    @Bean("researchChatClient")
    public ChatClient researchChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    @Bean("fallbackChatClient")
    public ChatClient fallbackChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Executor for source fetches, one worker per allowed in-flight fetch.
     * Claims beyond the cap wait in the queue, not on a thread of their own.
     */
    @Bean(name = "verificationExecutor", destroyMethod = "shutdown")
    public ExecutorService verificationExecutor(ResearchProperties properties) {
        return Executors.newFixedThreadPool(properties.verification().concurrency(), namedDaemonThreads("verify-"));
    }

    /**
     * Single worker for submitted jobs: runs write into their own directories,
     * but report generation is expensive, so jobs are queued.
     */
    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor() {
        return Executors.newSingleThreadExecutor(namedDaemonThreads("pipeline-"));
    }

    /**
     * ObjectMapper shared for artifact serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
