package com.vortex.firewall.service;

import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import com.vortex.firewall.config.MetricsConfig;
import com.vortex.firewall.config.TwilioNotificationConfig;
import com.vortex.firewall.model.AlertRecord;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * SMS / WhatsApp channel for alerts at or above {@code twilio.min-severity}.
 */
@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}, min severity: {}",
                    config.getChannel(), config.getMinSeverity());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Async
    public void notify(AlertRecord alert) {
        if (!config.isEnabled() || !config.shouldPage(alert.getSeverity())) {
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    AlertService.formatAlertMessage(alert)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio alert sent for {} on {}, sid={}",
                    alert.getAlertType(), alert.getResourceId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio alert for {}: {}", alert.getResourceId(), e.getMessage(), e);
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
