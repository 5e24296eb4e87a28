package com.vortex.firewall.config;

import com.vortex.firewall.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TwilioNotificationConfigTest {

    @Test
    void shouldPage_defaultPagesHighAndCriticalOnly() {
        TwilioNotificationConfig config = new TwilioNotificationConfig();

        assertThat(config.shouldPage(Severity.LOW)).isFalse();
        assertThat(config.shouldPage(Severity.MEDIUM)).isFalse();
        assertThat(config.shouldPage(Severity.HIGH)).isTrue();
        assertThat(config.shouldPage(Severity.CRITICAL)).isTrue();
    }

    @Test
    void shouldPage_loweredThreshold() {
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        config.setMinSeverity(Severity.MEDIUM);

        assertThat(config.shouldPage(Severity.MEDIUM)).isTrue();
        assertThat(config.shouldPage(Severity.LOW)).isFalse();
    }
}
