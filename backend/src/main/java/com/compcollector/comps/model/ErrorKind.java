package com.compcollector.comps.model;

public enum ErrorKind {
    SESSION_CRASHED(true),
    CONTEXT_DESTROYED(true),
    NAVIGATION_TIMEOUT(false),
    CONTENT_SHAPE(false),
    CONFIGURATION(false),
    OTHER(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
