package com.compcollector.comps.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchTier {
    VERIFIED("verified"),
    LIKELY("likely"),
    WEAK("weak"),
    NONE("none");

    private final String value;

    MatchTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Buckets a similarity score. Thresholds are inclusive lower bounds; anything under
     * {@code minScore} is {@link #NONE} whatever the other thresholds are.
     */
    public static MatchTier classify(double score, double minScore, double likelyScore, double verifiedScore) {
        if (score < minScore) {
            return NONE;
        }
        if (score >= verifiedScore) {
            return VERIFIED;
        }
        if (score >= likelyScore) {
            return LIKELY;
        }
        return WEAK;
    }
}
