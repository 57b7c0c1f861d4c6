package com.example.research.controller;

import com.example.research.model.ResearchJob;
import com.example.research.model.RunArtifacts;
import com.example.research.model.StageResult;
import com.example.research.orchestrator.ResearchPipelineOrchestrator;
import com.example.research.service.ArtifactNotFoundException;
import com.example.research.service.CorruptArtifactException;
import com.example.research.service.ResearchJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller exposing the pipeline and each of its stages.
 */
@RestController
@RequestMapping("/api/research")
public class ResearchController {

    private static final Logger log = LoggerFactory.getLogger(ResearchController.class);

    private final ResearchPipelineOrchestrator orchestrator;
    private final ResearchJobService jobService;

    public ResearchController(ResearchPipelineOrchestrator orchestrator, ResearchJobService jobService) {
        this.orchestrator = orchestrator;
        this.jobService = jobService;
    }

    /**
     * Runs the full pipeline synchronously.
     *
     * <p>Endpoint: POST /api/research/run
     * <p>Body: {"prompt": "..."}
     */
    @PostMapping("/run")
    public ResponseEntity<?> run(@RequestBody Map<String, String> body) {
        String prompt = body.get("prompt");
        if (prompt == null || prompt.isBlank()) {
            return badRequest("Missing 'prompt'.");
        }
        log.info("Received run request ({} characters)", prompt.length());
        return execute("run", () -> {
            RunArtifacts artifacts = orchestrator.run(prompt);
            return ResponseEntity.ok()
                    .header("X-Pipeline-Total-Seconds", String.valueOf(artifacts.pipelineTimings().totalSeconds()))
                    .body(artifacts);
        });
    }

    /**
     * <p>Endpoint: POST /api/research/extract
     * <p>Body: {"reportPath": "runs/20250101_120000/report.md"}
     */
    @PostMapping("/extract")
    public ResponseEntity<?> extract(@RequestBody Map<String, String> body) {
        String reportPath = body.get("reportPath");
        if (reportPath == null || reportPath.isBlank()) {
            return badRequest("Missing 'reportPath'.");
        }
        return execute("extract", () -> stage(orchestrator.extract(Path.of(reportPath))));
    }

    /**
     * <p>Endpoint: POST /api/research/verify
     * <p>Body: {"claimsPath": "runs/20250101_120000/claims.json"}
     */
    @PostMapping("/verify")
    public ResponseEntity<?> verify(@RequestBody Map<String, String> body) {
        String claimsPath = body.get("claimsPath");
        if (claimsPath == null || claimsPath.isBlank()) {
            return badRequest("Missing 'claimsPath'.");
        }
        return execute("verify", () -> stage(orchestrator.verify(Path.of(claimsPath))));
    }

    /**
     * <p>Endpoint: POST /api/research/compile
     * <p>Body: {"runDir": "runs/20250101_120000"}
     */
    @PostMapping("/compile")
    public ResponseEntity<?> compile(@RequestBody Map<String, String> body) {
        String runDir = body.get("runDir");
        if (runDir == null || runDir.isBlank()) {
            return badRequest("Missing 'runDir'.");
        }
        return execute("compile", () -> stage(orchestrator.compile(Path.of(runDir))));
    }

    /**
     * Submits a full run in the background.
     *
     * <p>Endpoint: POST /api/research/jobs
     */
    @PostMapping("/jobs")
    public ResponseEntity<?> submit(@RequestBody Map<String, String> body) {
        String prompt = body.get("prompt");
        if (prompt == null || prompt.isBlank()) {
            return badRequest("Missing 'prompt'.");
        }
        ResearchJob job = jobService.submit(prompt);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    /**
     * <p>Endpoint: GET /api/research/jobs/{id}
     */
    @GetMapping("/jobs/{id}")
    public ResponseEntity<?> job(@PathVariable String id) {
        return jobService.status(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Unknown job: " + id)));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "research-verifier"
        ));
    }

    private ResponseEntity<?> stage(StageResult result) {
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<?> execute(String stage, Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (ArtifactNotFoundException e) {
            log.warn("{}: {}", stage, e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (CorruptArtifactException e) {
            log.error("{}: {}", stage, e.getMessage());
            return ResponseEntity.unprocessableEntity().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error during {}", stage, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during " + stage,
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
