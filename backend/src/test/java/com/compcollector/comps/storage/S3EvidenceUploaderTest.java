package com.compcollector.comps.storage;

import com.compcollector.comps.model.UploadResult;
import com.compcollector.comps.service.JobConfigurationException;
import com.compcollector.config.CollectorProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3EvidenceUploaderTest {

    @Mock
    private S3Client s3Client;

    @Test
    void missingSettingsAreAllNamed() {
        CollectorProperties properties = new CollectorProperties();
        properties.getStorage().setBucket("comps");
        S3EvidenceUploader uploader = new S3EvidenceUploader(properties, s3Client);

        assertThatThrownBy(uploader::ensureConfigured)
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("collector.storage.endpoint")
            .hasMessageContaining("collector.storage.region")
            .hasMessageContaining("collector.storage.access-key-id")
            .hasMessageContaining("collector.storage.secret-access-key")
            .hasMessageContaining("collector.storage.base-url")
            .satisfies(e -> assertThat(e.getMessage()).doesNotContain("collector.storage.bucket"));
    }

    @Test
    void uploadWithoutConfigurationNeverReachesBucket() {
        S3EvidenceUploader uploader = new S3EvidenceUploader(new CollectorProperties(), s3Client);

        assertThatThrownBy(() -> uploader.upload(new byte[] {1}, "job/a.jpg", "image/jpeg"))
            .isInstanceOf(JobConfigurationException.class);
        verifyNoInteractions(s3Client);
    }

    @Test
    void uploadsPublicObjectUnderPrefix() {
        S3EvidenceUploader uploader = new S3EvidenceUploader(configured(), s3Client);

        UploadResult result = uploader.upload(new byte[] {1, 2, 3}, "job-1/ebay_sold-comp-1-herbert.jpg", "image/jpeg");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        PutObjectRequest request = captor.getValue();
        assertEquals("comps", request.bucket());
        assertEquals("comp-collector/job-1/ebay_sold-comp-1-herbert.jpg", request.key());
        assertEquals("image/jpeg", request.contentType());
        assertEquals(ObjectCannedACL.PUBLIC_READ, request.acl());
        assertEquals("comp-collector/job-1/ebay_sold-comp-1-herbert.jpg", result.key());
        assertEquals("https://comps.cdn.test/comp-collector/job-1/ebay_sold-comp-1-herbert.jpg", result.url());
    }

    @Test
    void storageErrorsPropagate() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
            .thenThrow(S3Exception.builder().message("Access Denied").build());
        S3EvidenceUploader uploader = new S3EvidenceUploader(configured(), s3Client);

        assertThatThrownBy(() -> uploader.upload(new byte[] {1}, "job/a.jpg", "image/jpeg"))
            .isInstanceOf(SdkException.class)
            .hasMessageContaining("Access Denied");
    }

    @Test
    void objectKeyTrimsSlashes() {
        assertEquals("p/a/b.jpg", S3EvidenceUploader.objectKey("/p/", "/a/b.jpg"));
        assertEquals("a/b.jpg", S3EvidenceUploader.objectKey("", "a/b.jpg"));
    }

    private CollectorProperties configured() {
        CollectorProperties properties = new CollectorProperties();
        CollectorProperties.Storage storage = properties.getStorage();
        storage.setEndpoint("https://nyc3.digitaloceanspaces.com");
        storage.setRegion("nyc3");
        storage.setBucket("comps");
        storage.setAccessKeyId("key");
        storage.setSecretAccessKey("secret");
        storage.setBaseUrl("https://comps.cdn.test/");
        return properties;
    }
}
