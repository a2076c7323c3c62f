package com.nursingjobs.pipeline.ingest.source;

/**
 * A source could not be read: network failure after retries, a timeout, or a page whose
 * layout no longer matches the configured selectors. Always fatal for the employer's run.
 */
public class AdapterFetchException extends RuntimeException {
    private final String employerSlug;
    private final String url;

    public AdapterFetchException(String employerSlug, String url, String message) {
        super(message);
        this.employerSlug = employerSlug;
        this.url = url;
    }

    public AdapterFetchException(String employerSlug, String url, String message, Throwable cause) {
        super(message, cause);
        this.employerSlug = employerSlug;
        this.url = url;
    }

    public String getEmployerSlug() {
        return employerSlug;
    }

    public String getUrl() {
        return url;
    }
}
