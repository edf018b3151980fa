package com.compcollector.comps.pattern;

import java.util.List;

/**
 * Accepted tiles ordered by score descending, plus how many distinct image tiles were scored.
 */
public record PatternScanResult(
    List<ScoredTile> matched,
    int scannedCount,
    int iterations
) {
    public PatternScanResult {
        matched = matched == null ? List.of() : List.copyOf(matched);
    }

    public boolean hasMatches() {
        return !matched.isEmpty();
    }
}
