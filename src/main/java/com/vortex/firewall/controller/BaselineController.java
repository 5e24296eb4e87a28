package com.vortex.firewall.controller;

import com.vortex.firewall.model.BaselineRecord;
import com.vortex.firewall.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "View the per-campaign reference values the detection rules compare against")
public class BaselineController {

    private final BaselineService baselineService;

    public BaselineController(BaselineService baselineService) {
        this.baselineService = baselineService;
    }

    @Operation(summary = "Get stored baselines for a campaign",
            description = "Returns one entry per tracked metric (daily_spend, ctr, clicks, impressions). " +
                    "404 when the campaign has never been observed.")
    @GetMapping("/{campaignId}")
    public ResponseEntity<List<BaselineRecord>> getBaselines(
            @Parameter(description = "Campaign ID", example = "120210000000000001")
            @PathVariable String campaignId) {
        List<BaselineRecord> baselines = baselineService.getBaselines(campaignId);
        if (baselines.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(baselines);
    }
}
