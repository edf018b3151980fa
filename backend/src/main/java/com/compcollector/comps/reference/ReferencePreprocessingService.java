package com.compcollector.comps.reference;

import com.compcollector.comps.image.ImageDecoder;
import com.compcollector.comps.image.ImageFetchException;
import com.compcollector.comps.image.ImageFetcher;
import com.compcollector.comps.model.ImageQuality;
import com.compcollector.comps.model.ReferenceImageRecord;
import com.compcollector.comps.persistence.ReferenceImageRepository;
import com.compcollector.comps.storage.EvidenceUploader;
import com.compcollector.comps.util.ErrorClassifier;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background pass that scores reference photos and stores normalized variant crops for them.
 */
@Service
public class ReferencePreprocessingService {
    private static final Logger log = LoggerFactory.getLogger(ReferencePreprocessingService.class);
    private static final float CROP_JPEG_QUALITY = 0.8f;

    private final ReferenceImageRepository repository;
    private final ImageFetcher imageFetcher;
    private final EvidenceUploader uploader;
    private final CollectorProperties properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public ReferencePreprocessingService(
        ReferenceImageRepository repository,
        ImageFetcher imageFetcher,
        EvidenceUploader uploader,
        CollectorProperties properties
    ) {
        this.repository = repository;
        this.imageFetcher = imageFetcher;
        this.uploader = uploader;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (!properties.getReference().isEnabled()) {
            return;
        }
        synchronized (lifecycleLock) {
            int intervalMs = properties.getReference().getPollIntervalMs();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("reference-preprocess");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::pollOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Reference preprocessing enabled (every {} ms)", intervalMs);
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }

    void pollOnce() {
        try {
            int processed = processPending(properties.getReference().getBatchSize());
            if (processed > 0) {
                log.info("Preprocessed {} reference images", processed);
            }
        } catch (Exception e) {
            log.warn("Reference preprocessing pass failed", e);
        }
    }

    /**
     * @return number of pending references examined
     */
    public int processPending(int limit) {
        List<ReferenceImageRecord> pending = repository.findPending(limit, properties.getReference().getMaxAttempts());
        for (ReferenceImageRecord reference : pending) {
            try {
                processReference(reference);
            } catch (RuntimeException e) {
                log.warn("Reference image {} preprocessing failed", reference.id(), e);
                recordFailure(reference.id(), "preprocess_failed: " + e.getMessage());
            }
        }
        return pending.size();
    }

    /**
     * Scores and crops one reference. Anything that cannot be computed keeps its stored value;
     * a fetch or decode failure counts as one attempt against the reference.
     *
     * @return {@code true} when a score or crops were stored
     */
    public boolean processReference(ReferenceImageRecord reference) {
        BufferedImage image;
        try {
            image = ImageDecoder.decodeRgb(imageFetcher.fetch(reference.rawImageUrl()));
        } catch (ImageFetchException | IOException e) {
            log.warn("Reference image {} could not be loaded from {}: {}", reference.id(), reference.rawImageUrl(), e.getMessage());
            recordFailure(reference.id(), e.getMessage());
            return false;
        }
        if (image == null) {
            log.warn("Reference image {} is not a decodable image", reference.id());
            recordFailure(reference.id(), "undecodable_image");
            return false;
        }

        ImageQuality quality = ReferenceImageQualityAnalyzer.analyze(image, properties.getReference().getMinDimension());
        List<String> cropUrls = null;
        if (reference.cropUrls().isEmpty()) {
            cropUrls = uploadCrops(reference.id(), image);
        }
        repository.updateProcessing(reference.id(), quality.score(), cropUrls);
        log.debug("Reference {} scored {} (variance {}, {}x{}), {} crops",
            reference.id(), quality.score(), quality.blur(), quality.width(), quality.height(),
            cropUrls == null ? 0 : cropUrls.size());
        return true;
    }

    private void recordFailure(String referenceId, String error) {
        try {
            repository.recordFailure(referenceId, error);
        } catch (RuntimeException e) {
            log.warn("Failed to record preprocessing failure for reference image {}", referenceId, e);
        }
    }

    private List<String> uploadCrops(String referenceId, BufferedImage image) {
        try {
            uploader.ensureConfigured();
            BufferedImage card = ReferenceCropGenerator.normalizeCard(image);
            List<String> urls = new ArrayList<>();
            for (CropSpec spec : ReferenceCropGenerator.buildCrops(card.getWidth(), card.getHeight())) {
                byte[] jpeg = ImageDecoder.encodeJpeg(ReferenceCropGenerator.crop(card, spec), CROP_JPEG_QUALITY);
                String key = "reference/" + referenceId + "/" + spec.label() + ".jpg";
                urls.add(uploader.upload(jpeg, key, "image/jpeg").url());
            }
            return urls;
        } catch (IOException | RuntimeException e) {
            log.warn("Crops for reference {} not stored: {}", referenceId, ErrorClassifier.describe(e));
            return null;
        }
    }
}
