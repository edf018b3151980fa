package com.compcollector.comps.service;

public class CompJobNotFoundException extends RuntimeException {
    public CompJobNotFoundException(String jobId) {
        super("Comp job not found: " + jobId);
    }
}
