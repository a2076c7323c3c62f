package com.nursingjobs.pipeline.ingest.classify;

/**
 * The classification service is unusable for the whole run (missing credentials, rejected key).
 */
public class ClassificationServiceException extends RuntimeException {
    public ClassificationServiceException(String message) {
        super(message);
    }
}
