package com.compcollector.comps.capture;

import com.compcollector.comps.browser.SourceAutomationException;
import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.model.UploadResult;
import com.compcollector.comps.storage.EvidenceUploader;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Takes viewport screenshots of marketplace pages and uploads them as evidence.
 */
@Service
public class EvidenceCaptureService {
    private static final Logger log = LoggerFactory.getLogger(EvidenceCaptureService.class);
    private static final String JPEG = "image/jpeg";

    private final EvidenceUploader uploader;
    private final CollectorProperties properties;

    public EvidenceCaptureService(EvidenceUploader uploader, CollectorProperties properties) {
        this.uploader = uploader;
        this.properties = properties;
    }

    /**
     * Captures a JPEG of the current viewport. On failure the page is reloaded once, and after a
     * short settle delay a second capture is attempted.
     *
     * @return the JPEG bytes, or {@code null} when both attempts fail
     */
    public byte[] captureWithRetry(SourcePage page) {
        int quality = properties.getCapture().getJpegQuality();
        try {
            return page.screenshotJpeg(quality);
        } catch (SourceAutomationException first) {
            log.debug("Screenshot failed on {}, reloading: {}", safeUrl(page), first.getMessage());
        }
        try {
            page.reload();
            page.waitForTimeout(properties.getCapture().getReloadDelayMs());
            return page.screenshotJpeg(quality);
        } catch (SourceAutomationException second) {
            log.warn("Screenshot retry failed on {}: {}", safeUrl(page), second.getMessage());
            return null;
        }
    }

    /**
     * Captures the page and uploads it under {@code key}.
     *
     * @return the public URL, or an empty string when no screenshot could be taken
     */
    public String captureAndUpload(SourcePage page, String key) {
        byte[] bytes = captureWithRetry(page);
        if (bytes == null || bytes.length == 0) {
            return "";
        }
        UploadResult uploaded = uploader.upload(bytes, key, JPEG);
        return uploaded.url();
    }

    private String safeUrl(SourcePage page) {
        try {
            return page.url();
        } catch (RuntimeException e) {
            return "<unknown>";
        }
    }
}
