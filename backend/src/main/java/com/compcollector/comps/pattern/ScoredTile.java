package com.compcollector.comps.pattern;

import com.compcollector.comps.model.ListingTile;
import com.compcollector.comps.model.PatternMatch;

public record ScoredTile(
    ListingTile tile,
    PatternMatch match
) {
}
