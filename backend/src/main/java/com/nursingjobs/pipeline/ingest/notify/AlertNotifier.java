package com.nursingjobs.pipeline.ingest.notify;

/**
 * Delivers run alerts and summaries. Implementations must not throw: a notification that cannot
 * be delivered is logged and dropped.
 */
public interface AlertNotifier {
    void sendAlert(String subject, String body);
}
