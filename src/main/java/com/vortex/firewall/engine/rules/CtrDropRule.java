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
 * Detects a click-through rate collapsing relative to the campaign's baseline,
 * typically a sign of bot impressions or broken creatives.
 *
 * Logic: ratio = current ctr / baseline ctr. Trips when the ratio falls below
 * the configured ctr-drop fraction (0.5 means "half of normal").
 */
@Component
public class CtrDropRule implements DetectionRule {

    @Override
    public FindingType getFindingType() {
        return FindingType.CTR_ANOMALY;
    }

    @Override
    public Optional<Finding> evaluate(DetectionContext context) {
        MetricSnapshot snapshot = context.getSnapshot();
        if (!snapshot.hasCtr()) {
            return Optional.empty();
        }

        OptionalDouble baseline = context.baseline(MetricType.CTR);
        if (baseline.isEmpty() || baseline.getAsDouble() <= 0) {
            return Optional.empty();
        }

        double historical = baseline.getAsDouble();
        double current = snapshot.getCtr();
        double ratio = current / historical;
        if (ratio >= context.getThresholds().getCtrDrop()) {
            return Optional.empty();
        }

        String message = String.format(
                "CTR dropped to %.4f from average %.4f (ratio: %.2f, threshold: %.2f)",
                current, historical, ratio, context.getThresholds().getCtrDrop());

        return Optional.of(Finding.builder()
                .type(FindingType.CTR_ANOMALY)
                .severity(Severity.MEDIUM)
                .resourceId(context.resourceId())
                .message(message)
                .ratio(ratio)
                .observedValue(current)
                .referenceValue(historical)
                .detectedAt(context.getEvaluatedAt())
                .build());
    }
}
