package com.compcollector.comps.model;

public record ImageQuality(
    double score,
    long blur,
    int width,
    int height
) {
}
