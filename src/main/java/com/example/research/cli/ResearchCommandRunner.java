package com.example.research.cli;

import com.example.research.model.ResearchJob;
import com.example.research.model.RunArtifacts;
import com.example.research.model.StageResult;
import com.example.research.orchestrator.ResearchPipelineOrchestrator;
import com.example.research.service.ResearchJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Command-line surface: one command per pipeline stage plus full runs.
 * <pre>
 *   submit  &lt;prompt&gt;    queue a full run and poll until it finishes
 *   extract &lt;report&gt;    citations.json + claims.json next to the report
 *   verify  &lt;claims&gt;    verification.json next to the claims
 *   compile &lt;run_dir&gt;   final_report.md in the run directory
 *   run     &lt;prompt&gt;    full pipeline in the foreground
 * </pre>
 * Does nothing when the application is started without a command (web mode).
 */
@Component
public class ResearchCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ResearchCommandRunner.class);

    private static final Set<String> COMMANDS = Set.of("submit", "extract", "verify", "compile", "run");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(2);

    private final ResearchPipelineOrchestrator orchestrator;
    private final ResearchJobService jobService;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public ResearchCommandRunner(ResearchPipelineOrchestrator orchestrator, ResearchJobService jobService) {
        this(orchestrator, jobService, System.out);
    }

    ResearchCommandRunner(ResearchPipelineOrchestrator orchestrator, ResearchJobService jobService, PrintStream out) {
        this.orchestrator = orchestrator;
        this.jobService = jobService;
        this.out = out;
    }

    public static boolean isCommand(String[] args) {
        return args != null && args.length > 0 && COMMANDS.contains(args[0]);
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty() || !COMMANDS.contains(words.get(0))) {
            return;
        }
        exitCode = execute(words);
    }

    int execute(List<String> words) {
        String command = words.get(0);
        if (words.size() < 2) {
            out.println("Usage: " + command + " <" + argumentName(command) + ">");
            return EXIT_USAGE;
        }
        String argument = String.join(" ", words.subList(1, words.size()));

        try {
            switch (command) {
                case "extract" -> print(orchestrator.extract(Path.of(argument)));
                case "verify" -> print(orchestrator.verify(Path.of(argument)));
                case "compile" -> print(orchestrator.compile(Path.of(argument)));
                case "run" -> print(orchestrator.run(argument));
                case "submit" -> {
                    return submitAndPoll(argument);
                }
                default -> {
                    return EXIT_USAGE;
                }
            }
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("{} failed: {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int submitAndPoll(String prompt) {
        ResearchJob job = jobService.submit(prompt);
        out.println("Submitted job " + job.id());
        while (!job.isDone()) {
            try {
                Thread.sleep(POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                out.println("Interrupted while waiting for job " + job.id());
                return EXIT_FAILED;
            }
            job = jobService.status(job.id()).orElseThrow();
            out.println("Job " + job.id() + ": " + job.state());
        }
        if (job.state() == ResearchJob.State.FAILED) {
            out.println("Error: " + job.error());
            return EXIT_FAILED;
        }
        out.println("Run directory: " + job.runDir());
        return EXIT_OK;
    }

    private void print(StageResult result) {
        out.println(result.stage() + ": " + result.counts());
        result.artifacts().forEach(p -> out.println("  wrote " + p));
    }

    private void print(RunArtifacts artifacts) {
        out.println("run: " + artifacts.runDir());
        out.println("  final report " + artifacts.finalReport());
        out.println("  total seconds " + "%.2f".formatted(artifacts.pipelineTimings().totalSeconds()));
    }

    private static String argumentName(String command) {
        return switch (command) {
            case "extract" -> "report";
            case "verify" -> "claims";
            case "compile" -> "run_dir";
            default -> "prompt";
        };
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
