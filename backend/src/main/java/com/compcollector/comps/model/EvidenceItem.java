package com.compcollector.comps.model;

public record EvidenceItem(
    String subjectId,
    String source,
    String title,
    String url,
    String screenshotUrl,
    String price,
    String soldDate,
    String note
) {
}
