package com.vortex.firewall.engine.rules;

import com.vortex.firewall.engine.DetectionContext;
import com.vortex.firewall.engine.DetectionRule;
import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.FindingType;
import com.vortex.firewall.model.MetricSnapshot;
import com.vortex.firewall.model.MetricType;
import com.vortex.firewall.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Detects a campaign spending much more than its baseline.
 *
 * Logic: ratio = current spend / baseline daily_spend. If the ratio exceeds
 * the configured spend-spike threshold the rule trips; above
 * {@link #CRITICAL_SPEND_RATIO} the finding is HIGH, otherwise MEDIUM.
 *
 * Guards: no baseline yet (cold start) or a zero baseline means no finding.
 *
 * Example: baseline 100, spend 350 gives ratio 3.5, a HIGH spike.
 */
@Component
public class SpendSpikeRule implements DetectionRule {

    /**
     * Ratio above which a spend spike is critical and eligible for auto-pause.
     * Fixed, not part of the configurable threshold set.
     */
    public static final double CRITICAL_SPEND_RATIO = 3.0;

    @Override
    public FindingType getFindingType() {
        return FindingType.SPENDING_SPIKE;
    }

    @Override
    public Optional<Finding> evaluate(DetectionContext context) {
        MetricSnapshot snapshot = context.getSnapshot();
        if (!snapshot.hasSpend()) {
            return Optional.empty();
        }

        OptionalDouble baseline = context.baseline(MetricType.DAILY_SPEND);
        if (baseline.isEmpty() || baseline.getAsDouble() <= 0) {
            return Optional.empty();
        }

        double historical = baseline.getAsDouble();
        double current = snapshot.getSpend();
        double ratio = current / historical;
        if (ratio <= context.getThresholds().getSpendSpike()) {
            return Optional.empty();
        }

        Severity severity = ratio > CRITICAL_SPEND_RATIO ? Severity.HIGH : Severity.MEDIUM;
        String message = String.format(
                "Campaign spending %.2f vs average %.2f (ratio: %.2f, threshold: %.2f)",
                current, historical, ratio, context.getThresholds().getSpendSpike());

        return Optional.of(Finding.builder()
                .type(FindingType.SPENDING_SPIKE)
                .severity(severity)
                .resourceId(context.resourceId())
                .message(message)
                .ratio(ratio)
                .observedValue(current)
                .referenceValue(historical)
                .detectedAt(context.getEvaluatedAt())
                .build());
    }
}
