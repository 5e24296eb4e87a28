package com.vortex.firewall.service;

import com.vortex.firewall.client.CampaignActuator;
import com.vortex.firewall.client.MetricsSource;
import com.vortex.firewall.config.FirewallConfig;
import com.vortex.firewall.config.MetaApiConfig;
import com.vortex.firewall.config.MetricsConfig;
import com.vortex.firewall.engine.AnomalyDetector;
import com.vortex.firewall.engine.DetectionContext;
import com.vortex.firewall.model.AlertRecord;
import com.vortex.firewall.model.Campaign;
import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.MetricSnapshot;
import com.vortex.firewall.model.RemediationAction;
import com.vortex.firewall.model.ScanSummary;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one scan cycle over the ad account.
 *
 * Flow per cycle:
 * 1. Fetch the account's campaigns (failure aborts the cycle)
 * 2. Per campaign: fetch insights for yesterday..today
 * 3. Load the stored baselines and run the anomaly detector
 * 4. Decide remediation per finding and pause critical spend spikes
 * 5. Record every finding with the alert sink
 * 6. Overwrite the baselines with this cycle's observation
 *
 * A failure in steps 2-6 only skips the affected campaign.
 */
@Service
public class FirewallScanService {

    private static final Logger log = LoggerFactory.getLogger(FirewallScanService.class);

    private final MetricsSource metricsSource;
    private final CampaignActuator campaignActuator;
    private final AnomalyDetector anomalyDetector;
    private final RemediationPolicy remediationPolicy;
    private final BaselineService baselineService;
    private final AlertService alertService;
    private final FirewallConfig firewallConfig;
    private final MetaApiConfig metaApiConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean scanInProgress = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicReference<ScanSummary> lastSummary = new AtomicReference<>();

    public FirewallScanService(MetricsSource metricsSource,
                               CampaignActuator campaignActuator,
                               AnomalyDetector anomalyDetector,
                               RemediationPolicy remediationPolicy,
                               BaselineService baselineService,
                               AlertService alertService,
                               FirewallConfig firewallConfig,
                               MetaApiConfig metaApiConfig,
                               MetricsConfig metricsConfig,
                               Clock clock) {
        this.metricsSource = metricsSource;
        this.campaignActuator = campaignActuator;
        this.anomalyDetector = anomalyDetector;
        this.remediationPolicy = remediationPolicy;
        this.baselineService = baselineService;
        this.alertService = alertService;
        this.firewallConfig = firewallConfig;
        this.metaApiConfig = metaApiConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Run a full scan cycle.
     *
     * @return the cycle summary, or empty when another scan is already running
     *         or shutdown has been requested
     */
    @Observed(name = "firewall.scan", contextualName = "firewall-scan")
    public Optional<ScanSummary> runScan() {
        if (stopRequested.get()) {
            log.info("Shutdown requested, not starting a new scan");
            return Optional.empty();
        }
        if (!scanInProgress.compareAndSet(false, true)) {
            log.info("Scan already in progress, skipping");
            return Optional.empty();
        }

        try {
            ScanSummary summary = doScan();
            lastSummary.set(summary);
            metricsConfig.recordScan(summary);
            return Optional.of(summary);
        } finally {
            scanInProgress.set(false);
        }
    }

    public Optional<ScanSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    public boolean isScanInProgress() {
        return scanInProgress.get();
    }

    /**
     * Let the running scan finish its current campaign, then stop; no new scan starts afterwards.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.info("Stop requested, the current campaign will be completed before exiting");
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        requestStop();
    }

    private ScanSummary doScan() {
        String scanId = UUID.randomUUID().toString();
        long startedAt = clock.millis();
        String accountId = metaApiConfig.getAdAccountId();
        log.info("Starting security scan {} for account {}", scanId, accountId);

        List<Campaign> campaigns;
        try {
            campaigns = metricsSource.listActiveCampaigns(accountId);
        } catch (RuntimeException e) {
            log.error("Scan {} aborted: could not fetch campaigns for {}: {}", scanId, accountId, e.getMessage(), e);
            return ScanSummary.builder()
                    .scanId(scanId)
                    .startedAt(startedAt)
                    .finishedAt(clock.millis())
                    .aborted(true)
                    .abortReason(e.getMessage())
                    .build();
        }

        LocalDate windowEnd = LocalDate.now(clock);
        LocalDate windowStart = windowEnd.minusDays(1);

        int scanned = 0;
        int failed = 0;
        int findings = 0;
        int pausesRequested = 0;
        int pausesSucceeded = 0;
        boolean stoppedEarly = false;

        for (Campaign campaign : campaigns) {
            if (stopRequested.get()) {
                stoppedEarly = true;
                log.info("Scan {} stopping early, {} of {} campaigns processed",
                        scanId, scanned + failed, campaigns.size());
                break;
            }

            CampaignOutcome outcome = scanCampaign(campaign, windowStart, windowEnd);
            if (outcome.failed) {
                failed++;
            } else {
                scanned++;
            }
            findings += outcome.findings;
            pausesRequested += outcome.pausesRequested;
            pausesSucceeded += outcome.pausesSucceeded;
        }

        ScanSummary summary = ScanSummary.builder()
                .scanId(scanId)
                .startedAt(startedAt)
                .finishedAt(clock.millis())
                .campaignsListed(campaigns.size())
                .campaignsScanned(scanned)
                .campaignsFailed(failed)
                .findings(findings)
                .pausesRequested(pausesRequested)
                .pausesSucceeded(pausesSucceeded)
                .stoppedEarly(stoppedEarly)
                .build();

        log.info("Security scan {} finished: campaigns={}, scanned={}, failed={}, findings={}, paused={}/{}",
                scanId, campaigns.size(), scanned, failed, findings, pausesSucceeded, pausesRequested);
        return summary;
    }

    private CampaignOutcome scanCampaign(Campaign campaign, LocalDate windowStart, LocalDate windowEnd) {
        CampaignOutcome outcome = new CampaignOutcome();
        String campaignId = campaign.getId();
        String stage = "fetch_snapshot";

        try {
            Optional<MetricSnapshot> fetched = metricsSource.getInsights(
                    campaignId, metaApiConfig.getInsightFields(), windowStart, windowEnd);
            if (fetched.isEmpty()) {
                log.debug("No insights for campaign {} between {} and {}", campaignId, windowStart, windowEnd);
                return outcome;
            }
            MetricSnapshot snapshot = fetched.get();

            stage = "detect";
            DetectionContext context = DetectionContext.builder()
                    .campaign(campaign)
                    .snapshot(snapshot)
                    .baselines(baselineService.loadBaselines(campaignId))
                    .thresholds(firewallConfig.thresholds())
                    .evaluatedAt(clock.millis())
                    .build();
            List<Finding> findings = anomalyDetector.detect(context);

            for (Finding finding : findings) {
                stage = "remediate";
                String action = AlertRecord.ACTION_ALERT;
                if (remediationPolicy.decide(finding) == RemediationAction.ALERT_AND_PAUSE) {
                    outcome.pausesRequested++;
                    if (pauseCampaign(campaignId, finding)) {
                        outcome.pausesSucceeded++;
                        action = AlertRecord.ACTION_PAUSED;
                    } else {
                        action = AlertRecord.ACTION_PAUSE_FAILED;
                    }
                }

                stage = "record";
                metricsConfig.recordFinding(finding);
                alertService.record(finding, action);
                outcome.findings++;
            }

            stage = "update_baseline";
            baselineService.recordSnapshot(campaignId, snapshot);
        } catch (RuntimeException e) {
            outcome.failed = true;
            metricsConfig.recordCampaignFailure(stage);
            log.error("Campaign {} skipped at stage {}: {}", campaignId, stage, e.getMessage(), e);
        }

        return outcome;
    }

    private boolean pauseCampaign(String campaignId, Finding finding) {
        String reason = String.format("Critical spending spike: %.2fx normal", finding.getRatio());
        boolean paused;
        try {
            paused = campaignActuator.pause(campaignId);
        } catch (RuntimeException e) {
            log.error("Error pausing campaign {}: {}", campaignId, e.getMessage(), e);
            paused = false;
        }

        if (paused) {
            metricsConfig.recordPause("success");
            log.warn("Campaign {} paused: {}", campaignId, reason);
            alertService.recordPause(campaignId, reason);
        } else {
            metricsConfig.recordPause("failure");
            log.error("Failed to pause campaign {} ({})", campaignId, reason);
        }
        return paused;
    }

    private static final class CampaignOutcome {
        private boolean failed;
        private int findings;
        private int pausesRequested;
        private int pausesSucceeded;
    }
}
