package com.compcollector.comps.model;

public record PlaybookRule(
    String id,
    String source,
    String action,
    String selector,
    String urlContains,
    String label,
    int priority,
    boolean enabled
) {
}
