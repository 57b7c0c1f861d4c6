package com.example.research.service;

import com.example.research.model.ResearchJob;
import com.example.research.model.RunArtifacts;
import com.example.research.orchestrator.ResearchPipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;

/**
 * Asynchronous submission of full pipeline runs, polled by job id.
 * Jobs live in memory only and are lost on restart. Only the most recent
 * {@value #MAX_FINISHED_JOBS} finished jobs are kept; older ones are evicted
 * as new jobs finish. Pending and running jobs are never evicted.
 */
@Service
public class ResearchJobService {

    private static final Logger log = LoggerFactory.getLogger(ResearchJobService.class);

    static final int MAX_FINISHED_JOBS = 100;

    private final ResearchPipelineOrchestrator orchestrator;
    private final ExecutorService pipelineExecutor;
    private final int maxFinishedJobs;
    private final Map<String, ResearchJob> jobs = new ConcurrentHashMap<>();
    private final Queue<String> finishedOrder = new ConcurrentLinkedQueue<>();

    @Autowired
    public ResearchJobService(ResearchPipelineOrchestrator orchestrator,
                              @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor) {
        this(orchestrator, pipelineExecutor, MAX_FINISHED_JOBS);
    }

    ResearchJobService(ResearchPipelineOrchestrator orchestrator, ExecutorService pipelineExecutor,
                       int maxFinishedJobs) {
        this.orchestrator = orchestrator;
        this.pipelineExecutor = pipelineExecutor;
        this.maxFinishedJobs = maxFinishedJobs;
    }

    /**
     * Queues a full run for the prompt.
     *
     * @return the pending job
     */
    public ResearchJob submit(String prompt) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        ResearchJob job = ResearchJob.pending(id);
        jobs.put(id, job);
        log.info("Job {} submitted", id);

        pipelineExecutor.execute(() -> {
            jobs.computeIfPresent(id, (k, j) -> j.running());
            try {
                RunArtifacts artifacts = orchestrator.run(prompt);
                jobs.computeIfPresent(id, (k, j) -> j.succeeded(artifacts.runDir()));
                log.info("Job {} succeeded: {}", id, artifacts.runDir());
            } catch (RuntimeException e) {
                log.error("Job {} failed", id, e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                jobs.computeIfPresent(id, (k, j) -> j.failed(message));
            }
            finishedOrder.add(id);
            evictFinished();
        });
        return job;
    }

    private void evictFinished() {
        while (finishedOrder.size() > maxFinishedJobs) {
            String oldest = finishedOrder.poll();
            if (oldest == null) break;
            jobs.remove(oldest);
            log.debug("Job {} evicted", oldest);
        }
    }

    public Optional<ResearchJob> status(String id) {
        return Optional.ofNullable(jobs.get(id));
    }
}
