package com.compcollector.comps.model;

import java.time.Instant;
import java.util.List;

public record JobResult(
    String jobId,
    String subjectId,
    String searchQuery,
    Instant generatedAt,
    List<SourceResult> sources
) {
    public JobResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
