package com.compcollector.comps.image;

public interface ImageFetcher {

    /**
     * Downloads the image bytes.
     *
     * @throws ImageFetchException when the URL is invalid, the request fails or the response is not 2xx
     */
    byte[] fetch(String url);
}
