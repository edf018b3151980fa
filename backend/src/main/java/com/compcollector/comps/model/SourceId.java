package com.compcollector.comps.model;

import java.util.Locale;
import java.util.Optional;

public enum SourceId {
    EBAY_SOLD("ebay_sold"),
    TCGPLAYER("tcgplayer"),
    PRICECHARTING("pricecharting"),
    CARDLADDER("cardladder");

    private final String key;

    SourceId(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<SourceId> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceId candidate : values()) {
            if (candidate.key.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
