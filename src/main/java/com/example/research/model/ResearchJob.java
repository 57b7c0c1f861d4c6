package com.example.research.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Snapshot of a submitted pipeline run.
 *
 * @param id          job identifier
 * @param state       lifecycle state
 * @param submittedAt submission time
 * @param runDir      run directory once the run has finished successfully
 * @param error       failure message when {@code state == FAILED}
 */
public record ResearchJob(
        String id,
        State state,
        Instant submittedAt,
        Path runDir,
        String error
) {
    public enum State { PENDING, RUNNING, SUCCEEDED, FAILED }

    public static ResearchJob pending(String id) {
        return new ResearchJob(id, State.PENDING, Instant.now(), null, null);
    }

    public ResearchJob running() {
        return new ResearchJob(id, State.RUNNING, submittedAt, null, null);
    }

    public ResearchJob succeeded(Path dir) {
        return new ResearchJob(id, State.SUCCEEDED, submittedAt, dir, null);
    }

    public ResearchJob failed(String message) {
        return new ResearchJob(id, State.FAILED, submittedAt, null, message);
    }

    public boolean isDone() {
        return state == State.SUCCEEDED || state == State.FAILED;
    }
}
