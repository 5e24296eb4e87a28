package com.vortex.firewall.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FirewallConfigTest {

    @Test
    void defaults_areValid() {
        assertThatCode(() -> new FirewallConfig().validate()).doesNotThrowAnyException();
    }

    @Test
    void nonPositiveInterval_isRejected() {
        FirewallConfig config = new FirewallConfig();
        config.setMonitoringIntervalSeconds(0);

        assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("monitoring-interval-seconds");
    }

    @Test
    void ctrDropOutsideUnitInterval_isRejected() {
        FirewallConfig config = new FirewallConfig();
        config.getSecurity().getThresholds().setCtrDrop(1.5);

        assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ctr-drop");
    }

    @Test
    void alphaOutOfRange_isRejected() {
        FirewallConfig config = new FirewallConfig();
        config.getBaseline().setAlpha(0);

        assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("alpha");
    }

    @Test
    void missingAccessToken_isRejected() {
        MetaApiConfig config = new MetaApiConfig();
        config.setAdAccountId("act_1");

        assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("access-token");
    }
}
