package com.vortex.firewall.controller;

import com.vortex.firewall.model.AlertRecord;
import com.vortex.firewall.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Query security alerts raised by the campaign scans")
public class AlertController {

    static final int MAX_LIMIT = 500;

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @Operation(summary = "List recent alerts",
            description = "Returns the most recent alerts across all campaigns, newest first.")
    @GetMapping
    public ResponseEntity<List<AlertRecord>> getRecentAlerts(
            @Parameter(description = "Maximum number of alerts to return (1-500)", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest().build();
        }
        List<AlertRecord> alerts = alertService.getRecentAlerts(limit);
        return ResponseEntity.ok(alerts);
    }

    @Operation(summary = "List alerts for a campaign",
            description = "Returns the alerts raised for one campaign, newest first. " +
                    "Includes CAMPAIGN_PAUSED entries for automatic pauses.")
    @GetMapping("/campaign/{campaignId}")
    public ResponseEntity<List<AlertRecord>> getCampaignAlerts(
            @Parameter(description = "Campaign ID", example = "120210000000000001")
            @PathVariable String campaignId,
            @Parameter(description = "Maximum number of alerts to return (1-500)", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(alertService.getAlertsForCampaign(campaignId, limit));
    }
}
