package com.compcollector.comps.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record EnqueueJobRequest(
    String searchQuery,
    List<String> sources,
    String subjectId,
    Integer maxComps,
    Integer maxAgeDays,
    JsonNode payload
) {
    public static final List<String> DEFAULT_SOURCES = List.of("ebay_sold", "tcgplayer");
    public static final int DEFAULT_MAX_COMPS = 5;
    public static final int DEFAULT_MAX_AGE_DAYS = 730;

    public List<String> normalizedSources() {
        if (sources == null || sources.isEmpty()) {
            return DEFAULT_SOURCES;
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String source : sources) {
            if (source == null || source.isBlank()) {
                continue;
            }
            normalized.add(source.trim().toLowerCase(Locale.ROOT));
        }
        return normalized.isEmpty() ? DEFAULT_SOURCES : new ArrayList<>(normalized);
    }

    public int effectiveMaxComps() {
        return maxComps == null ? DEFAULT_MAX_COMPS : Math.max(1, maxComps);
    }

    public int effectiveMaxAgeDays() {
        return maxAgeDays == null ? DEFAULT_MAX_AGE_DAYS : Math.max(1, maxAgeDays);
    }
}
