package com.mirrorgroups.insights.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.entity.AnalysisJob;
import com.mirrorgroups.insights.entity.AnalysisJob.JobStatus;
import com.mirrorgroups.insights.exception.AnalysisJobNotFoundException;
import com.mirrorgroups.insights.model.insight.AnalysisOptions;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.repository.AnalysisJobRepository;
import com.mirrorgroups.insights.service.GroupAnalysisOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Analysis Job Processor
 *
 * Works the analysis queue with a hard cap on in-flight jobs per process.
 *
 * Job discovery:
 * - Push: a notification names one job, processed at once if it is still pending
 * - Poll: every poll interval, ready pending jobs fill the free slots, highest
 *   priority first, then oldest first
 *
 * A job is started only after it is reserved in the in-memory running set and then
 * claimed in the database with a conditional PENDING to PROCESSING update. The first
 * guards against the two discovery paths racing in this process, the second against
 * other processes.
 *
 * Failed jobs go back to PENDING with a retry delay until the retry budget is used up,
 * then they are marked FAILED with the last error kept verbatim.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Service
@Slf4j
public class AnalysisJobProcessor {

    private static final long SHUTDOWN_POLL_MILLIS = 100;

    private final AnalysisJobRepository jobRepository;
    private final GroupAnalysisOrchestrator orchestrator;
    private final GroupInsightsProperties properties;
    private final Executor jobExecutor;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Set<UUID> runningJobs = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public AnalysisJobProcessor(AnalysisJobRepository jobRepository,
                                GroupAnalysisOrchestrator orchestrator,
                                GroupInsightsProperties properties,
                                @Qualifier("analysisJobExecutor") Executor jobExecutor,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.jobRepository = jobRepository;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.jobExecutor = jobExecutor;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Poll path
     */
    @Scheduled(fixedDelayString = "${insights.queue.poll-interval:PT5S}", initialDelayString = "${insights.queue.poll-interval:PT5S}")
    public void pollForJobs() {
        if (!isRunning()) {
            return;
        }

        int available = properties.getQueue().getMaxConcurrentJobs() - runningJobs.size();
        if (available <= 0) {
            log.debug("All {} job slots busy, skipping poll", properties.getQueue().getMaxConcurrentJobs());
            return;
        }

        List<AnalysisJob> ready = jobRepository.findReady(JobStatus.PENDING, now(), PageRequest.of(0, available));
        if (ready.isEmpty()) {
            return;
        }

        log.debug("Poll found {} ready jobs for {} free slots", ready.size(), available);
        for (AnalysisJob job : ready) {
            if (!tryStart(job.getId())) {
                log.debug("Job {} not started on this poll", job.getId());
            }
        }
    }

    /**
     * Push path. Starts the job if it is still pending and a slot is free; otherwise the
     * job is left for a later poll.
     *
     * @return true when the job was started by this call
     */
    public boolean processJob(UUID jobId) {
        if (!isRunning()) {
            log.debug("Processor not accepting jobs, leaving {} for later", jobId);
            return false;
        }
        boolean started = tryStart(jobId);
        if (!started) {
            log.debug("Job {} not started on notification", jobId);
        }
        return started;
    }

    @PreDestroy
    public void shutdown() {
        if (!accepting.getAndSet(false)) {
            return;
        }
        Duration timeout = properties.getQueue().getShutdownTimeout();
        log.info("Shutting down analysis job processor, waiting up to {} for {} running jobs",
            timeout, runningJobs.size());

        long deadline = System.nanoTime() + timeout.toNanos();
        while (!runningJobs.isEmpty() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(SHUTDOWN_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        if (runningJobs.isEmpty()) {
            log.info("Analysis job processor stopped cleanly");
        } else {
            log.warn("Analysis job processor stopped with {} jobs still running: {}",
                runningJobs.size(), runningJobs);
        }
    }

    public boolean isRunning() {
        return accepting.get() && properties.getQueue().isEnabled();
    }

    public Set<UUID> getRunningJobs() {
        return Set.copyOf(runningJobs);
    }

    public QueueStats getStats() {
        GroupInsightsProperties.Queue queue = properties.getQueue();
        return QueueStats.builder()
            .running(isRunning())
            .currentJobs(runningJobs.stream().map(UUID::toString).sorted().collect(Collectors.toList()))
            .maxConcurrentJobs(queue.getMaxConcurrentJobs())
            .pollInterval(queue.getPollInterval())
            .maxRetries(queue.getMaxRetries())
            .retryDelay(queue.getRetryDelay())
            .build();
    }

    private boolean tryStart(UUID jobId) {
        if (!reserve(jobId)) {
            return false;
        }

        boolean submitted = false;
        try {
            if (jobRepository.claim(jobId, JobStatus.PENDING, JobStatus.PROCESSING, now()) == 0) {
                log.debug("Job {} is no longer pending", jobId);
                return false;
            }
            jobExecutor.execute(() -> execute(jobId));
            submitted = true;
            return true;
        } catch (TaskRejectedException e) {
            log.error("Executor rejected job {}, returning it to the queue", jobId, e);
            releaseClaim(jobId);
            return false;
        } finally {
            if (!submitted) {
                runningJobs.remove(jobId);
            }
        }
    }

    /**
     * Capacity check and insertion happen under one lock so push and poll cannot
     * overfill the slots between them.
     */
    private synchronized boolean reserve(UUID jobId) {
        if (!accepting.get() || runningJobs.size() >= properties.getQueue().getMaxConcurrentJobs()) {
            return false;
        }
        return runningJobs.add(jobId);
    }

    void execute(UUID jobId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            AnalysisJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new AnalysisJobNotFoundException(jobId));
            run(job);
        } catch (AnalysisJobNotFoundException e) {
            log.error("Claimed job {} disappeared before it could run", jobId);
        } finally {
            runningJobs.remove(jobId);
            sample.stop(meterRegistry.timer("insights.job.duration"));
        }
    }

    private void run(AnalysisJob job) {
        log.info("Processing analysis job {} for group {} (attempt {})",
            job.getId(), job.getGroupId(), job.getRetryCount() + 1);

        try {
            GroupAnalysisResult result = orchestrator.analyzeGroup(job.getGroupId(),
                AnalysisOptions.builder().forceRefresh(true).build());

            job.markCompleted(summarize(result), now());
            jobRepository.save(job);
            meterRegistry.counter("insights.jobs", "outcome", "completed").increment();
            log.info("Analysis job {} completed in {} ms", job.getId(), job.processingTime().toMillis());
        } catch (RuntimeException e) {
            GroupInsightsProperties.Queue queue = properties.getQueue();
            boolean retrying = job.recordFailure(errorMessage(e), queue.getMaxRetries(), queue.getRetryDelay(), now());
            jobRepository.save(job);

            if (retrying) {
                meterRegistry.counter("insights.jobs", "outcome", "retried").increment();
                log.warn("Analysis job {} failed (attempt {} of {}), retrying at {}: {}",
                    job.getId(), job.getRetryCount(), queue.getMaxRetries(), job.getNextRetryAt(), e.getMessage());
            } else {
                meterRegistry.counter("insights.jobs", "outcome", "failed").increment();
                log.error("Analysis job {} failed permanently after {} attempts", job.getId(), job.getRetryCount(), e);
            }
        }
    }

    private void releaseClaim(UUID jobId) {
        jobRepository.findById(jobId).ifPresent(job -> {
            if (job.getStatus() == JobStatus.PROCESSING) {
                job.setStatus(JobStatus.PENDING);
                job.setStartedAt(null);
                jobRepository.save(job);
            }
        });
    }

    private String summarize(GroupAnalysisResult result) {
        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("analysisId", result.getAnalysisId());
        summary.put("memberCount", result.getMemberCount());
        summary.put("overallConfidence", result.getMetadata() != null ? result.getMetadata().getOverallConfidence() : 0.0);
        summary.put("strengths", result.getStrengths() != null ? result.getStrengths().size() : 0);
        summary.put("risks", result.getRisks() != null ? result.getRisks().size() : 0);
        summary.put("synthesis", result.getSynthesis() != null ? result.getSynthesis().getStrategy().name() : null);
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            log.warn("Could not write summary for analysis {}: {}", result.getAnalysisId(), e.getOriginalMessage());
            return null;
        }
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
