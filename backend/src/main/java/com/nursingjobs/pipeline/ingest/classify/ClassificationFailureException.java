package com.nursingjobs.pipeline.ingest.classify;

/**
 * One job could not be classified: upstream error, timeout or a malformed answer. The job stays
 * pending and is retried on a later run.
 */
public class ClassificationFailureException extends RuntimeException {
    public ClassificationFailureException(String message) {
        super(message);
    }

    public ClassificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
