package com.example.research.service;

import java.nio.file.Path;

/**
 * An artifact exists but cannot be parsed. Fatal to the stage reading it:
 * a degraded report is never produced from a corrupt input.
 */
public class CorruptArtifactException extends RuntimeException {

    private final Path path;

    public CorruptArtifactException(Path path, Throwable cause) {
        super("Corrupt artifact " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
