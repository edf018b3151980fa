package com.compcollector.comps.model;

import java.util.List;

/**
 * Everything one source attempt needs besides the browser session.
 */
public record SourceRequest(
    String jobId,
    String query,
    int maxComps,
    String categoryType,
    List<PlaybookRule> rules,
    ImageSignature referenceSignature
) {
    public SourceRequest {
        maxComps = Math.max(1, maxComps);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public boolean patternMatchingRequested() {
        return referenceSignature != null;
    }
}
