package com.vortex.firewall.controller;

import com.vortex.firewall.model.ScanSummary;
import com.vortex.firewall.service.FirewallScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/scans")
@Tag(name = "Scans", description = "Inspect and trigger campaign security scans")
public class ScanController {

    private final FirewallScanService scanService;

    public ScanController(FirewallScanService scanService) {
        this.scanService = scanService;
    }

    @GetMapping("/last")
    @Operation(summary = "Get the summary of the most recent scan",
               description = "404 until the first scan has completed")
    public ResponseEntity<ScanSummary> getLastScan() {
        return scanService.getLastSummary()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/run")
    @Operation(summary = "Run a scan immediately",
               description = "Runs a full scan on the calling thread and returns its summary. " +
                       "409 when a scan is already in progress or the service is shutting down.")
    public ResponseEntity<?> runScan() {
        Optional<ScanSummary> summary = scanService.runScan();
        if (summary.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "A scan is already in progress or the service is stopping"
            ));
        }
        return ResponseEntity.ok(summary.get());
    }
}
