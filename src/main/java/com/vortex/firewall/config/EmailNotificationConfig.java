package com.vortex.firewall.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Email alert routing. SMTP transport settings live under {@code spring.mail.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "email")
public class EmailNotificationConfig {

    private boolean enabled = false;
    private String from = "vortex-firewall@vortexconsultants.com";

    /** Receives every alert. */
    private String primary;

    /** Added to the recipients of HIGH and CRITICAL alerts. */
    private String emergency;

    private String subjectPrefix = "Vortex Firewall Alert";
}
