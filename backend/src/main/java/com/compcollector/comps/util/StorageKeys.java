package com.compcollector.comps.util;

import java.util.Locale;

public final class StorageKeys {
    private static final int MAX_KEY_PART_LENGTH = 60;

    private StorageKeys() {
    }

    public static String toSafeKeyPart(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        return normalized.length() > MAX_KEY_PART_LENGTH
            ? normalized.substring(0, MAX_KEY_PART_LENGTH)
            : normalized;
    }

    public static String joinUrl(String base, String path) {
        String safeBase = base == null ? "" : base.replaceAll("/+$", "");
        String safePath = path == null ? "" : path.replaceAll("^/+", "");
        return safeBase + "/" + safePath;
    }

    public static String searchScreenshotKey(String jobId, String sourceKey, String query) {
        return jobId + "/" + sourceKey + "-search-" + toSafeKeyPart(query) + ".jpg";
    }

    public static String compScreenshotKey(String jobId, String sourceKey, int position, String title) {
        return jobId + "/" + sourceKey + "-comp-" + position + "-" + toSafeKeyPart(title) + ".jpg";
    }
}
