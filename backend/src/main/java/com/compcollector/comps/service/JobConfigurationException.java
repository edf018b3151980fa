package com.compcollector.comps.service;

/**
 * Pipeline-setup failure that is fatal to the job and is never retried.
 */
public class JobConfigurationException extends RuntimeException {
    public JobConfigurationException(String message) {
        super(message);
    }
}
