package com.compcollector.comps.service;

import com.compcollector.comps.model.CompJob;
import com.compcollector.comps.model.CompQueueStats;
import com.compcollector.comps.model.CompWorkerStatusResponse;
import com.compcollector.comps.model.ImageSignature;
import com.compcollector.comps.model.JobResult;
import com.compcollector.comps.model.JobStatus;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.persistence.CompJobRepository;
import com.compcollector.comps.persistence.SubjectRepository;
import com.compcollector.comps.storage.EvidenceUploader;
import com.compcollector.comps.util.ErrorClassifier;
import com.compcollector.config.CollectorProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class CompWorkerService {
    private static final Logger log = LoggerFactory.getLogger(CompWorkerService.class);
    private static final int ERROR_SAMPLE_LIMIT = 5;
    static final String WORKER_LOST = "worker_lost";

    private final CompJobRepository jobRepository;
    private final SourceOrchestratorService orchestrator;
    private final EvidenceUploader uploader;
    private final ReferenceSignatureResolver referenceResolver;
    private final SubjectRepository subjectRepository;
    private final EvidenceAutoAttachService autoAttachService;
    private final ObjectMapper objectMapper;
    private final CollectorProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private volatile ScheduledExecutorService sweeper;
    private int activeWorkerCount;

    public CompWorkerService(
        CompJobRepository jobRepository,
        SourceOrchestratorService orchestrator,
        EvidenceUploader uploader,
        ReferenceSignatureResolver referenceResolver,
        SubjectRepository subjectRepository,
        EvidenceAutoAttachService autoAttachService,
        ObjectMapper objectMapper,
        CollectorProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.orchestrator = orchestrator;
        this.uploader = uploader;
        this.referenceResolver = referenceResolver;
        this.subjectRepository = subjectRepository;
        this.autoAttachService = autoAttachService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.instanceId = "comp-worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public CompWorkerStatusResponse getStatus() {
        CompQueueStats stats;
        try {
            stats = jobRepository.fetchQueueStats(ERROR_SAMPLE_LIMIT);
        } catch (Exception e) {
            log.warn("Failed to load comp queue stats", e);
            stats = new CompQueueStats(0, 0, null, List.of());
        }
        return new CompWorkerStatusResponse(running.get(), activeWorkerCount, stats);
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getWorker().getConcurrency();
            int pollIntervalMs = properties.getWorker().getPollIntervalMs();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("comp-worker");
                thread.setDaemon(true);
                return thread;
            });
            sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("comp-lease-keeper");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            int sweepSeconds = properties.getWorker().getStaleSweepIntervalSeconds();
            sweeper.scheduleWithFixedDelay(this::sweepStaleJobs, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
            log.info("Comp worker started with {} workers (poll {} ms)", workerCount, pollIntervalMs);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (sweeper != null) {
                sweeper.shutdownNow();
                sweeper = null;
            }
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Comp worker stopped");
        }
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        Thread.currentThread().setName("comp-worker-" + workerIndex);
        String lockOwner = instanceId + "-" + workerIndex;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Optional<CompJob> claimed;
            try {
                claimed = jobRepository.claimNextQueuedJob(lockOwner);
            } catch (Exception e) {
                log.warn("Comp worker {} failed to claim a job", workerIndex, e);
                sleep(pollIntervalMs);
                continue;
            }

            if (claimed.isEmpty()) {
                sleep(pollIntervalMs);
                continue;
            }

            CompJob job = claimed.get();
            log.info("Comp worker {} picked job {} (attempt {})", workerIndex, job.id(), job.attempts());
            try {
                processJob(job, lockOwner);
            } catch (Exception e) {
                log.warn("Comp worker {} failed while processing job {}", workerIndex, job.id(), e);
                markFailedQuietly(job.id(), ErrorClassifier.describe(e));
            }
        }
    }

    /**
     * Runs one claimed job to a terminal state. Post-completion side effects are isolated and
     * never change the stored status. The job's lease is refreshed while it runs.
     */
    void processJob(CompJob job, String lockOwner) {
        JobResult result;
        String resultJson;
        ScheduledFuture<?> lease = scheduleLeaseRefresh(job.id(), lockOwner);
        try {
            result = runJob(job);
            resultJson = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Comp job {} result could not be serialized", job.id(), e);
            markFailedQuietly(job.id(), "result_serialization_failed: " + e.getOriginalMessage());
            return;
        } catch (Exception e) {
            String message = ErrorClassifier.describe(e);
            log.warn("Comp job {} failed: {}", job.id(), message, e);
            markFailedQuietly(job.id(), message);
            return;
        } finally {
            if (lease != null) {
                lease.cancel(false);
            }
        }

        if (!jobRepository.markJobStatus(job.id(), JobStatus.COMPLETE, null, resultJson)) {
            log.error("Comp job {} finished but is no longer RUNNING; result with {} sources not stored",
                job.id(), result.sources().size());
            return;
        }
        long failedSources = result.sources().stream().filter(SourceResult::hasError).count();
        log.info("Comp job {} complete: {} sources, {} with errors", job.id(), result.sources().size(), failedSources);
        runSideEffects(job, result);
    }

    JobResult runJob(CompJob job) {
        if (job.sources().isEmpty()) {
            throw new JobConfigurationException("No sources provided.");
        }
        if (job.searchQuery() == null || job.searchQuery().isBlank()) {
            throw new JobConfigurationException("Search query is empty.");
        }
        uploader.ensureConfigured();

        ImageSignature reference = null;
        if (properties.getPattern().isEnabled()) {
            reference = referenceResolver.resolve(job).orElse(null);
        }

        List<SourceResult> sources = orchestrator.collect(
            job.id(),
            job.sources(),
            job.searchQuery(),
            job.maxComps(),
            job.payloadText("categoryType"),
            reference
        );
        return new JobResult(job.id(), job.subjectId(), job.searchQuery(), Instant.now(), sources);
    }

    private void runSideEffects(CompJob job, JobResult result) {
        if (job.subjectId() == null) {
            return;
        }
        try {
            subjectRepository.updateReviewStage(job.subjectId(), SubjectRepository.READY_FOR_HUMAN_REVIEW);
        } catch (Exception e) {
            log.warn("Failed to update review stage for subject {} after job {}", job.subjectId(), job.id(), e);
        }
        try {
            autoAttachService.attach(job.subjectId(), result);
        } catch (Exception e) {
            log.warn("Failed to auto-attach evidence for subject {} after job {}", job.subjectId(), job.id(), e);
        }
    }

    void refreshLease(String jobId, String lockOwner) {
        try {
            if (!jobRepository.refreshLock(jobId, lockOwner)) {
                log.warn("Lease for comp job {} is no longer held by {}", jobId, lockOwner);
            }
        } catch (Exception e) {
            log.warn("Failed to refresh lease for comp job {}", jobId, e);
        }
    }

    long leaseRefreshSeconds() {
        return Math.max(5L, properties.getWorker().getStaleJobMinutes() * 60L / 4);
    }

    private ScheduledFuture<?> scheduleLeaseRefresh(String jobId, String lockOwner) {
        ScheduledExecutorService scheduler = sweeper;
        if (scheduler == null || lockOwner == null) {
            return null;
        }
        long period = leaseRefreshSeconds();
        try {
            return scheduler.scheduleWithFixedDelay(
                () -> refreshLease(jobId, lockOwner), period, period, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Lease refresh not scheduled for comp job {}: worker is stopping", jobId);
            return null;
        }
    }

    void sweepStaleJobs() {
        try {
            Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getWorker().getStaleJobMinutes()));
            int failed = jobRepository.failStaleRunningJobs(cutoff, WORKER_LOST);
            if (failed > 0) {
                log.warn("Marked {} stale RUNNING comp jobs as failed", failed);
            }
        } catch (Exception e) {
            log.warn("Stale comp job sweep failed", e);
        }
    }

    private void markFailedQuietly(String jobId, String message) {
        try {
            jobRepository.markJobStatus(jobId, JobStatus.FAILED, message, null);
        } catch (Exception ex) {
            log.warn("Failed to record failure for comp job {}", jobId, ex);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
