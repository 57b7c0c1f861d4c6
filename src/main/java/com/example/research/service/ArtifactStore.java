package com.example.research.service;

import com.example.research.config.ResearchProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * File-based persistence of pipeline artifacts.
 * <p>
 * Every stage reads its inputs from here and writes its output here, so stages can be
 * re-run on their own. Writes are independent; there are no transactions.
 */
@Service
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String PROMPT = "prompt.txt";
    public static final String REPORT = "report.md";
    public static final String CITATIONS = "citations.json";
    public static final String CLAIMS = "claims.json";
    public static final String VERIFICATION = "verification.json";
    public static final String FINAL_REPORT = "final_report.md";

    private static final DateTimeFormatter RUN_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Path runsDir;

    public ArtifactStore(ObjectMapper objectMapper, ResearchProperties properties) {
        this.objectMapper = objectMapper;
        this.runsDir = Path.of(properties.runsDir());
    }

    /**
     * Creates a fresh run directory named after the current time.
     * A numeric suffix is added when a run started within the same second.
     */
    public Path createRunDirectory() {
        String base = LocalDateTime.now().format(RUN_DIR_FORMAT);
        try {
            Files.createDirectories(runsDir);
            Path dir = runsDir.resolve(base);
            for (int suffix = 2; Files.exists(dir); suffix++) {
                dir = runsDir.resolve(base + "_" + suffix);
            }
            Files.createDirectory(dir);
            log.info("Run directory created: {}", dir);
            return dir;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create run directory under " + runsDir, e);
        }
    }

    public Path writeText(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
            log.debug("Artifact written: {} ({} characters)", file, content.length());
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing artifact " + file, e);
        }
    }

    public String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading artifact " + file, e);
        }
    }

    public Path writeJson(Path file, Object value) {
        try {
            return writeText(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize artifact " + file, e);
        }
    }

    /**
     * Reads a required JSON artifact.
     *
     * @throws ArtifactNotFoundException if the file does not exist
     * @throws CorruptArtifactException  if the file is not valid JSON of the expected shape
     */
    public <T> T readJson(Path file, Class<T> type) {
        String json = readText(file);
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new CorruptArtifactException(file, new IllegalStateException("empty document"));
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new CorruptArtifactException(file, e);
        }
    }

    /** Reads an optional JSON artifact, falling back when the file is absent. Corrupt files still fail. */
    public <T> T readJsonOrDefault(Path file, Class<T> type, Supplier<T> fallback) {
        if (!Files.exists(file)) {
            log.debug("Optional artifact {} absent, using empty default", file.getFileName());
            return fallback.get();
        }
        return readJson(file, type);
    }

    public Path getRunsDir() {
        return runsDir;
    }
}
