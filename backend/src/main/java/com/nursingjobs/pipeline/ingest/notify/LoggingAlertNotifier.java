package com.nursingjobs.pipeline.ingest.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback when mail delivery is disabled: alerts go to the summary log only.
 */
public class LoggingAlertNotifier implements AlertNotifier {
    private static final Logger summary = LoggerFactory.getLogger("PIPELINE_SUMMARY");

    @Override
    public void sendAlert(String subject, String body) {
        summary.info("ALERT {}\n{}", subject, body);
    }
}
