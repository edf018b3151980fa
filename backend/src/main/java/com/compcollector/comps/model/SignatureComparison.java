package com.compcollector.comps.model;

public record SignatureComparison(
    double score,
    int distance,
    double colorDistance
) {
}
