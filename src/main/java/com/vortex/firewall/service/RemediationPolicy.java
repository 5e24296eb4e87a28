package com.vortex.firewall.service;

import com.vortex.firewall.config.FirewallConfig;
import com.vortex.firewall.engine.rules.SpendSpikeRule;
import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.FindingType;
import com.vortex.firewall.model.RemediationAction;
import org.springframework.stereotype.Component;

/**
 * Decides, per finding, whether an alert is enough or the campaign should also
 * be paused. Only critical spend spikes pause, and only when
 * {@code firewall.security.auto-actions.pause-campaign-critical} is on.
 */
@Component
public class RemediationPolicy {

    private final FirewallConfig config;

    public RemediationPolicy(FirewallConfig config) {
        this.config = config;
    }

    public RemediationAction decide(Finding finding) {
        if (!config.isAutoPauseEnabled()) {
            return RemediationAction.ALERT_ONLY;
        }
        if (finding.getType() == FindingType.SPENDING_SPIKE
                && finding.getRatio() > SpendSpikeRule.CRITICAL_SPEND_RATIO) {
            return RemediationAction.ALERT_AND_PAUSE;
        }
        return RemediationAction.ALERT_ONLY;
    }
}
