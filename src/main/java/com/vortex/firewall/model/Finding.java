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
@Schema(description = "A single anomaly detected for a campaign during a scan")
public class Finding {

    @Schema(description = "Classification", example = "SPENDING_SPIKE")
    private FindingType type;

    @Schema(description = "Urgency", example = "HIGH")
    private Severity severity;

    @Schema(description = "Campaign the finding is about", example = "120210000000000001")
    private String resourceId;

    @Schema(description = "Human-readable explanation with numeric evidence",
            example = "Campaign spending 350.00 vs baseline 100.00 (ratio: 3.50)")
    private String message;

    @Schema(description = "Ratio that tripped the rule (raw count for click volume)", example = "3.5")
    private double ratio;

    @Schema(description = "Current observed value", example = "350.0")
    private double observedValue;

    @Schema(description = "Value the observation was compared against", example = "100.0")
    private double referenceValue;

    @Schema(description = "Detection time in epoch milliseconds", example = "1739886764000")
    private long detectedAt;
}
