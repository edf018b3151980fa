package com.compcollector.comps.model;

import java.util.List;

public record SourceResult(
    String source,
    String searchUrl,
    String searchScreenshotUrl,
    List<Comp> comps,
    String error
) {
    public SourceResult {
        searchUrl = searchUrl == null ? "" : searchUrl;
        searchScreenshotUrl = searchScreenshotUrl == null ? "" : searchScreenshotUrl;
        comps = comps == null ? List.of() : List.copyOf(comps);
    }

    public static SourceResult success(String source, String searchUrl, String searchScreenshotUrl, List<Comp> comps) {
        return new SourceResult(source, searchUrl, searchScreenshotUrl, comps, null);
    }

    public static SourceResult failed(String source, String searchUrl, String error) {
        return new SourceResult(source, searchUrl, "", List.of(), error == null || error.isBlank() ? "source_failed" : error);
    }

    public boolean hasError() {
        return error != null;
    }
}
