package com.compcollector.comps.model;

import java.time.Instant;
import java.util.List;

public record CompQueueStats(
    long queuedCount,
    long runningCount,
    Instant oldestQueuedAt,
    List<CompQueueErrorSample> lastErrors
) {
}
