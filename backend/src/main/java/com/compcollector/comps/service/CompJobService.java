package com.compcollector.comps.service;

import com.compcollector.comps.model.CompJobView;
import com.compcollector.comps.model.EnqueueJobRequest;
import com.compcollector.comps.persistence.CompJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CompJobService {
    private static final Logger log = LoggerFactory.getLogger(CompJobService.class);

    private final CompJobRepository jobRepository;

    public CompJobService(CompJobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    public CompJobView enqueue(EnqueueJobRequest request) {
        if (request == null || request.searchQuery() == null || request.searchQuery().isBlank()) {
            throw new IllegalArgumentException("searchQuery is required");
        }
        String id = jobRepository.enqueue(request);
        log.info("Enqueued comp job {} for '{}' on {}", id, request.searchQuery().trim(), request.normalizedSources());
        return getJob(id);
    }

    public CompJobView getJob(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new CompJobNotFoundException(jobId));
    }

    /**
     * Requeues a finished job. Jobs that are still QUEUED or RUNNING cannot be reset.
     */
    public CompJobView reset(String jobId) {
        CompJobView current = getJob(jobId);
        if (!current.status().isTerminal() || !jobRepository.reset(jobId)) {
            throw new IllegalStateException("Comp job " + jobId + " is " + current.status() + " and cannot be reset");
        }
        log.info("Comp job {} reset to QUEUED", jobId);
        return getJob(jobId);
    }
}
