package com.compcollector.comps.service;

import com.compcollector.comps.image.ImageSignatureService;
import com.compcollector.comps.model.CompJob;
import com.compcollector.comps.model.ImageSignature;
import com.compcollector.comps.persistence.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Finds the reference photo for a job: the payload's {@code referenceImageUrl}, else the card
 * asset's stored image.
 */
@Service
public class ReferenceSignatureResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceSignatureResolver.class);
    static final String PAYLOAD_FIELD = "referenceImageUrl";

    private final SubjectRepository subjectRepository;
    private final ImageSignatureService signatureService;

    public ReferenceSignatureResolver(SubjectRepository subjectRepository, ImageSignatureService signatureService) {
        this.subjectRepository = subjectRepository;
        this.signatureService = signatureService;
    }

    public Optional<ImageSignature> resolve(CompJob job) {
        String url = job.payloadText(PAYLOAD_FIELD);
        if (url == null && job.subjectId() != null) {
            try {
                url = subjectRepository.findImageUrl(job.subjectId()).orElse(null);
            } catch (DataAccessException e) {
                log.warn("Failed to load reference image for subject {}", job.subjectId(), e);
            }
        }
        if (url == null) {
            return Optional.empty();
        }
        Optional<ImageSignature> signature = signatureService.computeSignature(url);
        if (signature.isEmpty()) {
            log.info("Reference image {} for job {} could not be fingerprinted; pattern matching skipped", url, job.id());
        }
        return signature;
    }
}
