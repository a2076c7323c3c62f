package com.nursingjobs.pipeline.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nursingjobs.pipeline.ingest.announce.Sleeper;
import com.nursingjobs.pipeline.ingest.notify.AlertNotifier;
import com.nursingjobs.pipeline.ingest.notify.LoggingAlertNotifier;
import com.nursingjobs.pipeline.ingest.notify.MailAlertNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(PipelineProperties properties) {
        int size = Math.max(4, properties.getClassification().getConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "classificationExecutor", destroyMethod = "shutdown")
    public ExecutorService classificationExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.getClassification().getConcurrency());
    }

    @Bean
    public AlertNotifier alertNotifier(PipelineProperties properties, ObjectProvider<JavaMailSender> mailSender) {
        PipelineProperties.Notify notify = properties.getNotify();
        JavaMailSender sender = mailSender.getIfAvailable();
        if (notify.isEnabled() && sender != null && notify.getTo() != null && !notify.getTo().isBlank()) {
            return new MailAlertNotifier(sender, notify);
        }
        if (notify.isEnabled()) {
            log.warn("Mail alerts enabled but no mail sender or recipient configured; alerts go to the summary log");
        }
        return new LoggingAlertNotifier();
    }

    @Bean
    public Sleeper sleeper() {
        return Thread::sleep;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
