package com.compcollector.comps.image;

import com.compcollector.config.CollectorProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

@Service
public class HttpImageFetcher implements ImageFetcher {
    private final CollectorProperties properties;
    private final HttpClient client;

    public HttpImageFetcher(CollectorProperties properties, HttpClient imageHttpClient) {
        this.properties = properties;
        this.client = imageHttpClient;
    }

    @Override
    public byte[] fetch(String url) {
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            throw new ImageFetchException("invalid_url: " + url);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getBrowser().getUserAgent())
            .header("Accept", "image/jpeg,image/png,image/webp;q=0.9,image/*;q=0.5")
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new ImageFetchException("http_" + status + ": " + url);
            }
            byte[] body = response.body();
            if (body == null || body.length == 0) {
                throw new ImageFetchException("empty_body: " + url);
            }
            if (body.length > properties.getHttp().getMaxImageBytes()) {
                throw new ImageFetchException("image_too_large: " + body.length + " bytes from " + url);
            }
            return body;
        } catch (HttpTimeoutException e) {
            throw new ImageFetchException("timeout: " + url, e);
        } catch (IOException e) {
            throw new ImageFetchException("io_error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageFetchException("interrupted: " + url, e);
        }
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (value.startsWith("//")) {
            value = "https:" + value;
        }
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
