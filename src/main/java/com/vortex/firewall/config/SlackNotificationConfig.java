package com.vortex.firewall.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackNotificationConfig {

    private boolean enabled = false;
    private String webhookUrl;
    private int timeoutSeconds = 10;
}
