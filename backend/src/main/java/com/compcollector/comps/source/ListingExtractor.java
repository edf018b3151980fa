package com.compcollector.comps.source;

import com.compcollector.comps.model.ListingDetail;
import com.compcollector.comps.model.ListingTile;

import java.util.List;

/**
 * Parses one marketplace's rendered HTML. Implementations never throw on unexpected markup;
 * missing fields come back as {@code null} and unusable tiles are dropped.
 */
public interface ListingExtractor {

    /**
     * Extracts search-result tiles in page order. Every returned tile has a title and an absolute URL.
     */
    List<ListingTile> extractTiles(String html, String baseUrl);

    ListingDetail extractDetail(String html, String baseUrl);
}
