package com.compcollector.comps.model;

public record RgbColor(int r, int g, int b) {
}
