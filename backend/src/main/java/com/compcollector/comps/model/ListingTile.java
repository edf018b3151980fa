package com.compcollector.comps.model;

public record ListingTile(
    String title,
    String url,
    String price,
    String soldDate,
    String imageUrl
) {
    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }
}
