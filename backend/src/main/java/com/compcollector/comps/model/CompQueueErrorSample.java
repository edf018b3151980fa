package com.compcollector.comps.model;

import java.time.Instant;

public record CompQueueErrorSample(
    String jobId,
    String errorMessage,
    Instant finishedAt,
    int attempts
) {
}
