package com.nursingjobs.pipeline.ingest.notify;

import com.nursingjobs.pipeline.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

public class MailAlertNotifier implements AlertNotifier {
    private static final Logger log = LoggerFactory.getLogger(MailAlertNotifier.class);

    private final JavaMailSender mailSender;
    private final PipelineProperties.Notify config;

    public MailAlertNotifier(JavaMailSender mailSender, PipelineProperties.Notify config) {
        this.mailSender = mailSender;
        this.config = config;
    }

    @Override
    public void sendAlert(String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(config.getFrom());
        message.setTo(config.getTo().split("\\s*,\\s*"));
        message.setSubject(subject);
        message.setText(body);
        try {
            mailSender.send(message);
            log.info("Sent alert '{}' to {}", subject, config.getTo());
        } catch (MailException e) {
            log.error("Failed to send alert '{}' to {}: {}", subject, config.getTo(), e.getMessage(), e);
        }
    }
}
