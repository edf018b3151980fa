package com.compcollector.comps.storage;

import com.compcollector.comps.model.UploadResult;
import com.compcollector.comps.service.JobConfigurationException;
import com.compcollector.comps.util.StorageKeys;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Uploads evidence to an S3-compatible bucket (DigitalOcean Spaces, MinIO, AWS).
 */
@Service
public class S3EvidenceUploader implements EvidenceUploader {
    private static final Logger log = LoggerFactory.getLogger(S3EvidenceUploader.class);

    private final CollectorProperties properties;
    private final Object clientLock = new Object();

    private volatile S3Client client;

    public S3EvidenceUploader(CollectorProperties properties) {
        this.properties = properties;
    }

    S3EvidenceUploader(CollectorProperties properties, S3Client client) {
        this.properties = properties;
        this.client = client;
    }

    @Override
    public UploadResult upload(byte[] bytes, String key, String contentType) {
        ensureConfigured();
        CollectorProperties.Storage storage = properties.getStorage();
        String objectKey = objectKey(storage.getPrefix(), key);
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(storage.getBucket())
            .key(objectKey)
            .contentType(contentType)
            .acl(ObjectCannedACL.PUBLIC_READ)
            .build();
        try {
            client().putObject(request, RequestBody.fromBytes(bytes));
        } catch (SdkException e) {
            log.warn("Upload of {} to bucket {} failed", objectKey, storage.getBucket(), e);
            throw e;
        }
        return new UploadResult(objectKey, StorageKeys.joinUrl(storage.getBaseUrl(), objectKey));
    }

    @Override
    public void ensureConfigured() {
        List<String> missing = missingSettings(properties.getStorage());
        if (!missing.isEmpty()) {
            throw new JobConfigurationException("Missing object storage configuration: " + String.join(", ", missing));
        }
    }

    @PreDestroy
    public void close() {
        S3Client current = client;
        if (current != null) {
            current.close();
        }
    }

    static String objectKey(String prefix, String key) {
        String cleanKey = key == null ? "" : key.replaceAll("^/+", "");
        String cleanPrefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
        return cleanPrefix.isEmpty() ? cleanKey : cleanPrefix + "/" + cleanKey;
    }

    static List<String> missingSettings(CollectorProperties.Storage storage) {
        List<String> missing = new ArrayList<>();
        addIfBlank(missing, "endpoint", storage.getEndpoint());
        addIfBlank(missing, "region", storage.getRegion());
        addIfBlank(missing, "bucket", storage.getBucket());
        addIfBlank(missing, "access-key-id", storage.getAccessKeyId());
        addIfBlank(missing, "secret-access-key", storage.getSecretAccessKey());
        addIfBlank(missing, "base-url", storage.getBaseUrl());
        return missing;
    }

    private static void addIfBlank(List<String> missing, String name, String value) {
        if (value == null || value.isBlank()) {
            missing.add("collector.storage." + name);
        }
    }

    private S3Client client() {
        S3Client current = client;
        if (current != null) {
            return current;
        }
        synchronized (clientLock) {
            if (client == null) {
                CollectorProperties.Storage storage = properties.getStorage();
                client = S3Client.builder()
                    .endpointOverride(URI.create(storage.getEndpoint().trim()))
                    .region(Region.of(storage.getRegion().trim()))
                    .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(storage.getAccessKeyId(), storage.getSecretAccessKey())
                    ))
                    .build();
                log.info("Object storage client initialized for bucket {}", storage.getBucket());
            }
            return client;
        }
    }
}
