package com.compcollector.comps.browser;

import com.compcollector.comps.model.ErrorKind;

/**
 * Browser automation failure, classified where it was caught.
 */
public class SourceAutomationException extends RuntimeException {
    private final ErrorKind kind;

    public SourceAutomationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind == null ? ErrorKind.OTHER : kind;
    }

    public SourceAutomationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.OTHER : kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
