package com.vortex.firewall.config;

import com.vortex.firewall.model.BaselineMode;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Detection thresholds, auto-actions and scan cadence. Bound once at startup;
 * nothing in the service writes to it afterwards.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "firewall")
public class FirewallConfig {

    // Seconds between the end of one scan and the start of the next
    private int monitoringIntervalSeconds = 60;

    private Security security = new Security();

    private Baseline baseline = new Baseline();

    private Scheduler scheduler = new Scheduler();

    @PostConstruct
    public void validate() {
        Thresholds t = security.getThresholds();
        if (monitoringIntervalSeconds <= 0) {
            throw new IllegalStateException("firewall.monitoring-interval-seconds must be > 0");
        }
        if (t.getSpendSpike() <= 0) {
            throw new IllegalStateException("firewall.security.thresholds.spend-spike must be > 0");
        }
        if (t.getCtrDrop() <= 0 || t.getCtrDrop() >= 1.0) {
            throw new IllegalStateException("firewall.security.thresholds.ctr-drop must be in (0, 1)");
        }
        if (t.getSuspiciousClicks() < 0) {
            throw new IllegalStateException("firewall.security.thresholds.suspicious-clicks must be >= 0");
        }
        if (t.getBudgetBreach() <= 0) {
            throw new IllegalStateException("firewall.security.thresholds.budget-breach must be > 0");
        }
        if (baseline.getMode() == null) {
            throw new IllegalStateException("firewall.baseline.mode must be set");
        }
        if (baseline.getAlpha() <= 0 || baseline.getAlpha() > 1.0) {
            throw new IllegalStateException("firewall.baseline.alpha must be in (0, 1]");
        }
    }

    public Thresholds thresholds() {
        return security.getThresholds();
    }

    public boolean isAutoPauseEnabled() {
        return security.getAutoActions().isPauseCampaignCritical();
    }

    @Data
    public static class Security {
        private Thresholds thresholds = new Thresholds();
        private AutoActions autoActions = new AutoActions();
    }

    @Data
    public static class Thresholds {
        // current spend / baseline spend above which a spike is reported
        private double spendSpike = 2.0;
        // current ctr / baseline ctr below which a drop is reported
        private double ctrDrop = 0.5;
        // absolute clicks in the lookback window
        private long suspiciousClicks = 1000;
        // spend / daily budget above which a breach is reported
        private double budgetBreach = 1.2;
    }

    @Data
    public static class AutoActions {
        private boolean pauseCampaignCritical = false;
    }

    @Data
    public static class Baseline {
        private BaselineMode mode = BaselineMode.REPLACE;
        // Only used in MOVING_AVERAGE mode
        private double alpha = 0.3;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private int initialDelaySeconds = 5;
    }
}
