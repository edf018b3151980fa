package com.compcollector.comps.image;

public class ImageFetchException extends RuntimeException {
    public ImageFetchException(String message) {
        super(message);
    }

    public ImageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
