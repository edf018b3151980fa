package com.compcollector.comps.reference;

public record CropSpec(
    String label,
    int left,
    int top,
    int width,
    int height
) {
}
