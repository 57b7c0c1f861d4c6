package com.example.research.cli;

import com.example.research.model.ResearchJob;
import com.example.research.model.StageResult;
import com.example.research.orchestrator.ResearchPipelineOrchestrator;
import com.example.research.service.ArtifactNotFoundException;
import com.example.research.service.ResearchJobService;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResearchCommandRunnerTest {

    private final ResearchPipelineOrchestrator orchestrator = mock(ResearchPipelineOrchestrator.class);
    private final ResearchJobService jobService = mock(ResearchJobService.class);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ResearchCommandRunner runner = new ResearchCommandRunner(orchestrator, jobService,
            new PrintStream(buffer, true, StandardCharsets.UTF_8));

    @Test
    void recognisesOnlyKnownCommands() {
        assertTrue(ResearchCommandRunner.isCommand(new String[]{"verify", "claims.json"}));
        assertFalse(ResearchCommandRunner.isCommand(new String[]{"--server.port=9090"}));
        assertFalse(ResearchCommandRunner.isCommand(new String[0]));
    }

    @Test
    void extractPrintsCounts() {
        Path report = Path.of("runs/r1/report.md");
        when(orchestrator.extract(report)).thenReturn(new StageResult("extract",
                List.of(Path.of("runs/r1/citations.json"), Path.of("runs/r1/claims.json")),
                Map.of("claims", 4)));

        int code = runner.execute(List.of("extract", "runs/r1/report.md"));

        assertEquals(ResearchCommandRunner.EXIT_OK, code);
        assertTrue(output().contains("extract: {claims=4}"));
        assertTrue(output().contains("claims.json"));
    }

    @Test
    void missingArgumentIsUsageError() {
        assertEquals(ResearchCommandRunner.EXIT_USAGE, runner.execute(List.of("compile")));
        assertTrue(output().contains("Usage: compile <run_dir>"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void stageFailureGivesNonZeroExit() {
        when(orchestrator.verify(any())).thenThrow(new ArtifactNotFoundException(Path.of("nope.json")));

        assertEquals(ResearchCommandRunner.EXIT_FAILED, runner.execute(List.of("verify", "nope.json")));
        assertTrue(output().contains("Artifact not found"));
    }

    @Test
    void runJoinsPromptWords() {
        when(orchestrator.run("why is the sky blue")).thenThrow(new RuntimeException("no credentials"));

        assertEquals(ResearchCommandRunner.EXIT_FAILED, runner.execute(List.of("run", "why", "is", "the", "sky", "blue")));
        verify(orchestrator).run("why is the sky blue");
    }

    @Test
    void submitPollsUntilJobFinishes() {
        ResearchJob pending = ResearchJob.pending("job1");
        when(jobService.submit("question")).thenReturn(pending);
        when(jobService.status("job1")).thenReturn(Optional.of(pending.succeeded(Path.of("runs/r9"))));

        assertEquals(ResearchCommandRunner.EXIT_OK, runner.execute(List.of("submit", "question")));
        assertTrue(output().contains("Submitted job job1"));
        assertTrue(output().contains("Run directory: " + Path.of("runs/r9")));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
