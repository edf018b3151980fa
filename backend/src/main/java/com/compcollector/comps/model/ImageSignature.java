package com.compcollector.comps.model;

/**
 * Perceptual fingerprint of an image: one bit per cell of the downsampled grid, set when the
 * cell is at least as bright as the grid mean.
 */
public record ImageSignature(
    String hashBits,
    RgbColor avgColor,
    int width,
    int height
) {
}
