package com.compcollector.comps.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public record CompJob(
    String id,
    JobStatus status,
    String subjectId,
    String searchQuery,
    List<String> sources,
    int maxComps,
    int maxAgeDays,
    JsonNode payload,
    int attempts,
    Instant createdAt,
    Instant completedAt
) {
    public CompJob {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * Reads a top-level text field from the opaque job payload, or {@code null} when absent.
     */
    public String payloadText(String field) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        JsonNode value = payload.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
