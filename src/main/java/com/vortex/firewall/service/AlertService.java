package com.vortex.firewall.service;

import com.vortex.firewall.model.AlertRecord;
import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.Severity;
import com.vortex.firewall.repository.AlertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Alert sink. Persists every alert and hands it to the notification channels.
 * Nothing here throws back into the scan: persistence and delivery failures
 * are logged and the alert is still passed on to the remaining channels.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final AlertRepository alertRepository;
    private final SlackNotificationService slackNotificationService;
    private final TwilioNotificationService twilioNotificationService;
    private final EmailNotificationService emailNotificationService;
    private final Clock clock;

    public AlertService(AlertRepository alertRepository,
                        SlackNotificationService slackNotificationService,
                        TwilioNotificationService twilioNotificationService,
                        EmailNotificationService emailNotificationService,
                        Clock clock) {
        this.alertRepository = alertRepository;
        this.slackNotificationService = slackNotificationService;
        this.twilioNotificationService = twilioNotificationService;
        this.emailNotificationService = emailNotificationService;
        this.clock = clock;
    }

    /**
     * Record a finding together with the remediation that was applied to it.
     */
    public AlertRecord record(Finding finding, String action) {
        AlertRecord alert = AlertRecord.builder()
                .alertId(UUID.randomUUID().toString())
                .alertType(finding.getType().name())
                .message(finding.getMessage())
                .resourceId(finding.getResourceId())
                .severity(finding.getSeverity())
                .action(action)
                .createdAt(clock.millis())
                .build();
        publish(alert);
        return alert;
    }

    public AlertRecord recordPause(String campaignId, String reason) {
        AlertRecord alert = AlertRecord.builder()
                .alertId(UUID.randomUUID().toString())
                .alertType(AlertRecord.TYPE_CAMPAIGN_PAUSED)
                .message("Campaign paused: " + reason)
                .resourceId(campaignId)
                .severity(Severity.HIGH)
                .action(AlertRecord.ACTION_PAUSED)
                .createdAt(clock.millis())
                .build();
        publish(alert);
        return alert;
    }

    public List<AlertRecord> getRecentAlerts(int limit) {
        try {
            return alertRepository.findRecent(limit);
        } catch (RuntimeException e) {
            log.warn("Alert store unavailable while listing alerts: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    public List<AlertRecord> getAlertsForCampaign(String campaignId, int limit) {
        try {
            return alertRepository.findByResourceId(campaignId, limit);
        } catch (RuntimeException e) {
            log.warn("Alert store unavailable while listing alerts for {}: {}", campaignId, e.getMessage());
            return Collections.emptyList();
        }
    }

    private void publish(AlertRecord alert) {
        log.warn("ALERT [{}] {} on {}: {} (action={})",
                alert.getSeverity(), alert.getAlertType(), alert.getResourceId(),
                alert.getMessage(), alert.getAction());

        try {
            alertRepository.save(alert);
        } catch (RuntimeException e) {
            log.error("Failed to persist alert {} for {}: {}",
                    alert.getAlertType(), alert.getResourceId(), e.getMessage(), e);
        }

        try {
            slackNotificationService.notify(alert);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch Slack alert for {}: {}", alert.getResourceId(), e.getMessage(), e);
        }

        try {
            twilioNotificationService.notify(alert);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch Twilio alert for {}: {}", alert.getResourceId(), e.getMessage(), e);
        }

        try {
            emailNotificationService.notify(alert);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch email alert for {}: {}", alert.getResourceId(), e.getMessage(), e);
        }
    }

    /**
     * Plain-text rendering shared by the notification channels.
     */
    static String formatAlertMessage(AlertRecord alert) {
        StringBuilder sb = new StringBuilder()
                .append("[VORTEX FIREWALL ALERT]\n")
                .append("Type: ").append(alert.getAlertType()).append('\n')
                .append("Severity: ").append(alert.getSeverity()).append('\n')
                .append("Resource: ").append(alert.getResourceId()).append('\n')
                .append("Message: ").append(alert.getMessage()).append('\n')
                .append("Action: ").append(alert.getAction()).append('\n')
                .append("Time: ").append(TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(alert.getCreatedAt())));
        if (alert.getSeverity().isUrgent()) {
            sb.append("\n\nPlease review immediately.");
        }
        return sb.toString();
    }
}
