package com.example.research.service;

import java.nio.file.Path;

/**
 * A required stage input (report, claims, run directory) does not exist.
 */
public class ArtifactNotFoundException extends RuntimeException {

    private final Path path;

    public ArtifactNotFoundException(Path path) {
        super("Artifact not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
