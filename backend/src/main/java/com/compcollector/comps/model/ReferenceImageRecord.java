package com.compcollector.comps.model;

import java.time.Instant;
import java.util.List;

public record ReferenceImageRecord(
    String id,
    String rawImageUrl,
    List<String> cropUrls,
    Double qualityScore,
    Instant createdAt
) {
    public ReferenceImageRecord {
        cropUrls = cropUrls == null ? List.of() : List.copyOf(cropUrls);
    }
}
