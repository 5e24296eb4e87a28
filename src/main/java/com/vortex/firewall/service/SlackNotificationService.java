package com.vortex.firewall.service;

import com.vortex.firewall.config.MetricsConfig;
import com.vortex.firewall.config.SlackNotificationConfig;
import com.vortex.firewall.model.AlertRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Map;

/**
 * Posts every alert to a Slack incoming webhook.
 */
@Service
public class SlackNotificationService {

    private static final Logger log = LoggerFactory.getLogger(SlackNotificationService.class);

    private final SlackNotificationConfig config;
    private final MetricsConfig metricsConfig;
    private final RestClient restClient;

    public SlackNotificationService(SlackNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        requestFactory.setReadTimeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();

        if (config.isEnabled() && (config.getWebhookUrl() == null || config.getWebhookUrl().isBlank())) {
            throw new IllegalStateException("slack.webhook-url is required when slack.enabled=true");
        }
    }

    @Async
    public void notify(AlertRecord alert) {
        if (!config.isEnabled()) {
            return;
        }

        try {
            restClient.post()
                    .uri(config.getWebhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("text", AlertService.formatAlertMessage(alert)))
                    .retrieve()
                    .toBodilessEntity();

            metricsConfig.recordNotification("slack", "success");
            log.info("Slack alert sent for {} on {}", alert.getAlertType(), alert.getResourceId());
        } catch (Exception e) {
            metricsConfig.recordNotification("slack", "error");
            log.error("Failed to send Slack alert for {}: {}", alert.getResourceId(), e.getMessage(), e);
        }
    }
}
