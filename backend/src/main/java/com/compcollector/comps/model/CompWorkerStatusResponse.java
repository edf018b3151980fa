package com.compcollector.comps.model;

public record CompWorkerStatusResponse(
    boolean running,
    int workerCount,
    CompQueueStats queue
) {
}
