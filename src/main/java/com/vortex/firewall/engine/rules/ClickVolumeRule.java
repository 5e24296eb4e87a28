package com.vortex.firewall.engine.rules;

import com.vortex.firewall.engine.DetectionContext;
import com.vortex.firewall.engine.DetectionRule;
import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.FindingType;
import com.vortex.firewall.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags an absolute click count above the suspicious-clicks threshold.
 * No baseline involved.
 */
@Component
public class ClickVolumeRule implements DetectionRule {

    @Override
    public FindingType getFindingType() {
        return FindingType.HIGH_CLICK_VOLUME;
    }

    @Override
    public Optional<Finding> evaluate(DetectionContext context) {
        if (!context.getSnapshot().hasClicks()) {
            return Optional.empty();
        }

        long clicks = context.getSnapshot().getClicks();
        long limit = context.getThresholds().getSuspiciousClicks();
        if (clicks <= limit) {
            return Optional.empty();
        }

        return Optional.of(Finding.builder()
                .type(FindingType.HIGH_CLICK_VOLUME)
                .severity(Severity.MEDIUM)
                .resourceId(context.resourceId())
                .message(String.format("Suspicious click volume: %d in last 24h (threshold: %d)", clicks, limit))
                .ratio(clicks)
                .observedValue(clicks)
                .referenceValue(limit)
                .detectedAt(context.getEvaluatedAt())
                .build());
    }
}
