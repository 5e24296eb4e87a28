package com.vortex.firewall.engine;

import com.vortex.firewall.config.FirewallConfig;
import com.vortex.firewall.model.Campaign;
import com.vortex.firewall.model.MetricSnapshot;
import com.vortex.firewall.model.MetricType;
import lombok.Builder;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Everything a detection rule may look at for one campaign. Baselines are
 * loaded before detection, so rules compare "now" against "before now" and
 * never touch the store themselves.
 */
@Data
@Builder
public class DetectionContext {

    private Campaign campaign;

    private MetricSnapshot snapshot;

    // Only metrics that have a stored baseline are present
    @Builder.Default
    private Map<MetricType, Double> baselines = new EnumMap<>(MetricType.class);

    private FirewallConfig.Thresholds thresholds;

    // Epoch millis stamped on every finding of this evaluation
    private long evaluatedAt;

    public OptionalDouble baseline(MetricType metricType) {
        Double value = baselines.get(metricType);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public String resourceId() {
        return campaign.getId();
    }
}
