package com.compcollector.comps.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public record CompJobView(
    String id,
    JobStatus status,
    String subjectId,
    String searchQuery,
    List<String> sources,
    int maxComps,
    int maxAgeDays,
    JsonNode payload,
    JsonNode result,
    String errorMessage,
    int attempts,
    String lockOwner,
    Instant lockedAt,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {
}
