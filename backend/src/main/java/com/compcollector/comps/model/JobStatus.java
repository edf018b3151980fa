package com.compcollector.comps.model;

public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
