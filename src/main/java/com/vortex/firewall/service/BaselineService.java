package com.vortex.firewall.service;

import com.aerospike.client.AerospikeException;
import com.vortex.firewall.config.FirewallConfig;
import com.vortex.firewall.config.MetricsConfig;
import com.vortex.firewall.model.BaselineMode;
import com.vortex.firewall.model.BaselineRecord;
import com.vortex.firewall.model.MetricSnapshot;
import com.vortex.firewall.model.MetricType;
import com.vortex.firewall.repository.BaselineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Baseline maintenance on top of {@link BaselineRepository}.
 *
 * In REPLACE mode (the default) a new observation overwrites the stored value:
 * the baseline is the last observation, not a long-run mean, so a sustained
 * anomaly becomes the new normal after one cycle. MOVING_AVERAGE blends the
 * observation in with weight {@code firewall.baseline.alpha}.
 *
 * Storage errors never reach the scan: reads degrade to "no baseline" and
 * failed writes leave the previous value in place. An update whose read of
 * the previous value fails is skipped, so stored history is never reset.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final BaselineRepository baselineRepository;
    private final FirewallConfig firewallConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public BaselineService(BaselineRepository baselineRepository,
                           FirewallConfig firewallConfig,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.baselineRepository = baselineRepository;
        this.firewallConfig = firewallConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @return the baseline value, or empty when none exists (which is not the same as zero)
     */
    public OptionalDouble getBaseline(MetricType metricType, String resourceId) {
        BaselineRecord record = findQuietly(metricType, resourceId);
        return record == null ? OptionalDouble.empty() : OptionalDouble.of(record.getValue());
    }

    /**
     * All stored baselines of a campaign, keyed by metric. Missing metrics are absent from the map.
     */
    public Map<MetricType, Double> loadBaselines(String resourceId) {
        Map<MetricType, Double> baselines = new EnumMap<>(MetricType.class);
        for (MetricType metricType : MetricType.values()) {
            getBaseline(metricType, resourceId).ifPresent(value -> baselines.put(metricType, value));
        }
        return baselines;
    }

    public void record(MetricType metricType, String resourceId, double value) {
        BaselineRecord previous;
        try {
            previous = baselineRepository.find(metricType, resourceId);
        } catch (AerospikeException e) {
            metricsConfig.recordStorageFailure("read");
            log.warn("Baseline store unavailable, skipping {} baseline update for {}: {}",
                    metricType.getKey(), resourceId, e.getMessage());
            return;
        }
        long samples = previous == null ? 1 : previous.getSampleCount() + 1;

        double newValue = value;
        if (firewallConfig.getBaseline().getMode() == BaselineMode.MOVING_AVERAGE && previous != null) {
            double alpha = firewallConfig.getBaseline().getAlpha();
            newValue = alpha * value + (1.0 - alpha) * previous.getValue();
        }

        BaselineRecord updated = BaselineRecord.builder()
                .metricType(metricType)
                .resourceId(resourceId)
                .value(newValue)
                .sampleCount(samples)
                .updatedAt(clock.millis())
                .build();

        try {
            baselineRepository.save(updated);
        } catch (AerospikeException e) {
            metricsConfig.recordStorageFailure("write");
            log.warn("Baseline store unavailable, keeping previous {} baseline for {}: {}",
                    metricType.getKey(), resourceId, e.getMessage());
        }
    }

    /**
     * Feed every metric present in the snapshot into its baseline.
     */
    public void recordSnapshot(String resourceId, MetricSnapshot snapshot) {
        if (snapshot.hasSpend()) {
            record(MetricType.DAILY_SPEND, resourceId, snapshot.getSpend());
        }
        if (snapshot.hasCtr()) {
            record(MetricType.CTR, resourceId, snapshot.getCtr());
        }
        if (snapshot.hasClicks()) {
            record(MetricType.CLICKS, resourceId, snapshot.getClicks());
        }
        if (snapshot.hasImpressions()) {
            record(MetricType.IMPRESSIONS, resourceId, snapshot.getImpressions());
        }
    }

    public List<BaselineRecord> getBaselines(String resourceId) {
        try {
            return baselineRepository.findByResourceId(resourceId);
        } catch (AerospikeException e) {
            metricsConfig.recordStorageFailure("scan");
            log.warn("Baseline store unavailable while listing baselines for {}: {}", resourceId, e.getMessage());
            return Collections.emptyList();
        }
    }

    private BaselineRecord findQuietly(MetricType metricType, String resourceId) {
        try {
            return baselineRepository.find(metricType, resourceId);
        } catch (AerospikeException e) {
            metricsConfig.recordStorageFailure("read");
            log.warn("Baseline store unavailable, treating {} baseline for {} as absent: {}",
                    metricType.getKey(), resourceId, e.getMessage());
            return null;
        }
    }
}
