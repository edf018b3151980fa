package com.compcollector.comps.model;

public record UploadResult(
    String key,
    String url
) {
}
