package com.compcollector.comps.image;

import com.compcollector.comps.model.ImageSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Optional;

@Service
public class ImageSignatureService {
    private static final Logger log = LoggerFactory.getLogger(ImageSignatureService.class);

    private final ImageFetcher imageFetcher;

    public ImageSignatureService(ImageFetcher imageFetcher) {
        this.imageFetcher = imageFetcher;
    }

    /**
     * Fetches and fingerprints an image. Any fetch or decode failure yields an empty result.
     */
    public Optional<ImageSignature> computeSignature(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return Optional.empty();
        }
        try {
            byte[] bytes = imageFetcher.fetch(imageUrl);
            return computeSignature(bytes);
        } catch (ImageFetchException e) {
            log.debug("Image fetch failed for {}: {}", imageUrl, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<ImageSignature> computeSignature(byte[] bytes) {
        try {
            BufferedImage image = ImageDecoder.decodeRgb(bytes);
            if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
                return Optional.empty();
            }
            return Optional.of(ImageSignatures.compute(image));
        } catch (IOException | RuntimeException e) {
            log.debug("Image decode failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
