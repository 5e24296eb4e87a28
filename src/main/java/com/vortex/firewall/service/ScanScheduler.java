package com.vortex.firewall.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Drives the periodic scan. Fixed delay, so the interval is measured from the
 * end of one scan to the start of the next and scans never overlap.
 */
@Component
@ConditionalOnProperty(prefix = "firewall.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScanScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScanScheduler.class);

    private final FirewallScanService scanService;

    public ScanScheduler(FirewallScanService scanService) {
        this.scanService = scanService;
    }

    @Scheduled(fixedDelayString = "${firewall.monitoring-interval-seconds:60}",
               initialDelayString = "${firewall.scheduler.initial-delay-seconds:5}",
               timeUnit = TimeUnit.SECONDS)
    public void scheduledScan() {
        try {
            scanService.runScan();
        } catch (Exception e) {
            log.error("Error in monitoring cycle: {}", e.getMessage(), e);
        }
    }
}
