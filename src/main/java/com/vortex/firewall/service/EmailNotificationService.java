package com.vortex.firewall.service;

import com.vortex.firewall.config.EmailNotificationConfig;
import com.vortex.firewall.config.MetricsConfig;
import com.vortex.firewall.model.AlertRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Mails every alert to the primary contact. HIGH and CRITICAL alerts also go
 * to the emergency contact when one is configured.
 */
@Service
public class EmailNotificationService {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationService.class);

    private final EmailNotificationConfig config;
    private final MetricsConfig metricsConfig;
    private final JavaMailSender mailSender;

    public EmailNotificationService(EmailNotificationConfig config,
                                    ObjectProvider<JavaMailSender> mailSenderProvider,
                                    MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.mailSender = mailSenderProvider.getIfAvailable();

        if (config.isEnabled()) {
            if (mailSender == null) {
                throw new IllegalStateException("spring.mail.host is required when email.enabled=true");
            }
            if (isBlank(config.getFrom()) || isBlank(config.getPrimary())) {
                throw new IllegalStateException("email.from and email.primary are required when email.enabled=true");
            }
        }
    }

    @Async
    public void notify(AlertRecord alert) {
        if (!config.isEnabled()) {
            return;
        }

        List<String> recipients = recipientsFor(alert);
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(config.getFrom());
            message.setTo(recipients.toArray(new String[0]));
            message.setSubject(config.getSubjectPrefix() + " - " + alert.getSeverity());
            message.setText(AlertService.formatAlertMessage(alert));
            mailSender.send(message);

            metricsConfig.recordNotification("email", "success");
            log.info("Email alert sent for {} issue on {} to {}",
                    alert.getSeverity(), alert.getResourceId(), recipients);
        } catch (Exception e) {
            metricsConfig.recordNotification("email", "error");
            log.error("Failed to send email alert for {}: {}", alert.getResourceId(), e.getMessage(), e);
        }
    }

    List<String> recipientsFor(AlertRecord alert) {
        List<String> recipients = new ArrayList<>();
        recipients.add(config.getPrimary());
        if (alert.getSeverity().isUrgent() && !isBlank(config.getEmergency())) {
            recipients.add(config.getEmergency());
        }
        return recipients;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
