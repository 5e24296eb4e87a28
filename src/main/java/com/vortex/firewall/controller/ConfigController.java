package com.vortex.firewall.controller;

import com.vortex.firewall.config.FirewallConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the detection configuration the service was started with")
public class ConfigController {

    private final FirewallConfig firewallConfig;

    public ConfigController(FirewallConfig firewallConfig) {
        this.firewallConfig = firewallConfig;
    }

    @Operation(summary = "Get detection thresholds and auto-actions",
            description = "Read-only. Values are fixed at startup.")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        FirewallConfig.Thresholds t = firewallConfig.thresholds();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("spendSpike", t.getSpendSpike());
        response.put("ctrDrop", t.getCtrDrop());
        response.put("suspiciousClicks", t.getSuspiciousClicks());
        response.put("budgetBreach", t.getBudgetBreach());
        response.put("pauseCampaignCritical", firewallConfig.isAutoPauseEnabled());
        response.put("monitoringIntervalSeconds", firewallConfig.getMonitoringIntervalSeconds());
        response.put("baselineMode", firewallConfig.getBaseline().getMode().name());
        return ResponseEntity.ok(response);
    }
}
