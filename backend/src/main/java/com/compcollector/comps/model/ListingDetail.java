package com.compcollector.comps.model;

public record ListingDetail(
    String price,
    String listingImageUrl
) {
    public static ListingDetail empty() {
        return new ListingDetail(null, null);
    }
}
