package com.vortex.firewall.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Persisted security alert")
public class AlertRecord {

    public static final String TYPE_CAMPAIGN_PAUSED = "CAMPAIGN_PAUSED";

    public static final String ACTION_ALERT = "ALERT";
    public static final String ACTION_PAUSED = "PAUSED";
    public static final String ACTION_PAUSE_FAILED = "PAUSE_FAILED";

    @Schema(description = "Alert identifier", example = "6f1c2a9e-3c43-4d2b-9a57-0f2b7c1d9e11")
    private String alertId;

    @Schema(description = "Finding type, or CAMPAIGN_PAUSED for an automatic pause", example = "SPENDING_SPIKE")
    private String alertType;

    @Schema(description = "Alert text with numeric evidence",
            example = "Campaign spending 350.00 vs baseline 100.00 (ratio: 3.50)")
    private String message;

    @Schema(description = "Campaign the alert is about", example = "120210000000000001")
    private String resourceId;

    @Schema(description = "Severity", example = "HIGH")
    private Severity severity;

    @Schema(description = "Remediation applied", example = "PAUSED", allowableValues = {"ALERT", "PAUSED", "PAUSE_FAILED"})
    private String action;

    @Schema(description = "Creation time in epoch milliseconds", example = "1739886764000")
    private long createdAt;
}
