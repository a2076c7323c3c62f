package com.nursingjobs.pipeline.ingest.notify;

import com.nursingjobs.pipeline.config.PipelineProperties;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MailAlertNotifierTest {
    private final JavaMailSender mailSender = mock(JavaMailSender.class);

    @Test
    void sendsToEveryConfiguredRecipient() {
        PipelineProperties.Notify config = new PipelineProperties.Notify();
        config.setFrom("pipeline@nursing.test");
        config.setTo("ops@nursing.test, oncall@nursing.test");

        new MailAlertNotifier(mailSender, config).sendAlert("[job-pipeline] lourdes pipeline completed", "Jobs found: 3");

        ArgumentCaptor<SimpleMailMessage> sent = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(sent.capture());
        assertThat(sent.getValue().getTo()).containsExactly("ops@nursing.test", "oncall@nursing.test");
        assertThat(sent.getValue().getFrom()).isEqualTo("pipeline@nursing.test");
        assertThat(sent.getValue().getSubject()).isEqualTo("[job-pipeline] lourdes pipeline completed");
        assertThat(sent.getValue().getText()).isEqualTo("Jobs found: 3");
    }

    @Test
    void deliveryFailureIsLoggedNotThrown() {
        PipelineProperties.Notify config = new PipelineProperties.Notify();
        config.setTo("ops@nursing.test");
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThatCode(() -> new MailAlertNotifier(mailSender, config).sendAlert("subject", "body"))
            .doesNotThrowAnyException();
    }
}
