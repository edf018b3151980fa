package com.compcollector.comps.model;

public record PatternMatch(
    double score,
    int distance,
    double colorDistance,
    MatchTier tier
) {
}
