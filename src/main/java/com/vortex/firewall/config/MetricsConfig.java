package com.vortex.firewall.config;

import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.ScanSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastScanFindings;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastScanFindings = registry.gauge("scan.last.findings", new AtomicInteger(0));
    }

    public void recordScan(ScanSummary summary) {
        String outcome = summary.isAborted() ? "aborted"
                : summary.isStoppedEarly() ? "stopped" : "completed";
        Counter.builder("scan.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("scan.campaigns")
                .register(registry)
                .record(summary.getCampaignsScanned());

        lastScanFindings.set(summary.getFindings());
    }

    public void recordFinding(Finding finding) {
        Counter.builder("finding.count")
                .tag("type", finding.getType().name())
                .tag("severity", finding.getSeverity().name())
                .register(registry)
                .increment();
    }

    public void recordRuleError(String ruleType) {
        Counter.builder("rule.error.count")
                .tag("rule_type", ruleType)
                .register(registry)
                .increment();
    }

    public void recordPause(String status) {
        Counter.builder("campaign.pause.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCampaignFailure(String stage) {
        Counter.builder("campaign.failure.count")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordStorageFailure(String operation) {
        Counter.builder("baseline.storage.failure.count")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
