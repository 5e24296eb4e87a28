package com.vortex.firewall.engine.rules;

import com.vortex.firewall.engine.DetectionContext;
import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.FindingType;
import com.vortex.firewall.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.vortex.firewall.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SpendSpikeRuleTest {

    private final SpendSpikeRule rule = new SpendSpikeRule();

    private DetectionContext context(Double spend, Double baselineSpend) {
        return createContext(createCampaign("C-1", null),
                createSnapshot("C-1", spend, null, null),
                baselines(baselineSpend, null));
    }

    @Test
    void spendMoreThanThreeTimesBaseline_isHighSeverity() {
        Optional<Finding> finding = rule.evaluate(context(350.0, 100.0));

        assertThat(finding).isPresent();
        assertThat(finding.get().getType()).isEqualTo(FindingType.SPENDING_SPIKE);
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.get().getRatio()).isCloseTo(3.5, within(1e-9));
        assertThat(finding.get().getObservedValue()).isEqualTo(350.0);
        assertThat(finding.get().getReferenceValue()).isEqualTo(100.0);
        assertThat(finding.get().getResourceId()).isEqualTo("C-1");
        assertThat(finding.get().getDetectedAt()).isEqualTo(NOW);
    }

    @Test
    void spendBetweenThresholdAndCriticalRatio_isMediumSeverity() {
        Optional<Finding> finding = rule.evaluate(context(250.0, 100.0));

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void ratioExactlyAtCriticalRatio_isMediumSeverity() {
        Optional<Finding> finding = rule.evaluate(context(300.0, 100.0));

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void ratioExactlyAtThreshold_doesNotTrigger() {
        assertThat(rule.evaluate(context(200.0, 100.0))).isEmpty();
    }

    @Test
    void noBaseline_doesNotTrigger() {
        assertThat(rule.evaluate(context(10_000.0, null))).isEmpty();
    }

    @Test
    void zeroBaseline_doesNotTrigger() {
        assertThat(rule.evaluate(context(500.0, 0.0))).isEmpty();
    }

    @Test
    void missingSpend_doesNotTrigger() {
        assertThat(rule.evaluate(context(null, 100.0))).isEmpty();
    }

    @Test
    void message_containsNumericEvidence() {
        Finding finding = rule.evaluate(context(350.0, 100.0)).orElseThrow();

        assertThat(finding.getMessage()).contains(String.format("%.2f", 350.0));
        assertThat(finding.getMessage()).contains(String.format("%.2f", 3.5));
    }
}
