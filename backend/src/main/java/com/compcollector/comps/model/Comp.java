package com.compcollector.comps.model;

public record Comp(
    String source,
    String title,
    String url,
    String price,
    String soldDate,
    String screenshotUrl,
    String listingImageUrl,
    String notes,
    PatternMatch patternMatch
) {
    public Comp {
        screenshotUrl = screenshotUrl == null ? "" : screenshotUrl;
    }
}
