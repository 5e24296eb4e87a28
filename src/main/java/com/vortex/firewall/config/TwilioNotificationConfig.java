package com.vortex.firewall.config;

import com.vortex.firewall.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Phone paging for on-call operators. Alerts below {@code min-severity} are
 * left to the log and Slack.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private String channel = "sms";  // "sms" or "whatsapp"
    private Severity minSeverity = Severity.HIGH;

    public boolean shouldPage(Severity severity) {
        return severity != null && severity.compareTo(minSeverity) >= 0;
    }
}
