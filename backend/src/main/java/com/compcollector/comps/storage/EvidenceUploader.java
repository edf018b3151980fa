package com.compcollector.comps.storage;

import com.compcollector.comps.model.UploadResult;

public interface EvidenceUploader {

    /**
     * Stores {@code bytes} publicly under the configured prefix.
     *
     * @throws com.compcollector.comps.service.JobConfigurationException when storage is not configured
     */
    UploadResult upload(byte[] bytes, String key, String contentType);

    /**
     * Fails fast with a configuration error naming every missing setting.
     */
    void ensureConfigured();
}
