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
@Schema(description = "Stored reference value for one metric of one campaign")
public class BaselineRecord {

    @Schema(description = "Metric the baseline tracks", example = "DAILY_SPEND")
    private MetricType metricType;

    @Schema(description = "Campaign the baseline belongs to", example = "120210000000000001")
    private String resourceId;

    @Schema(description = "Current baseline value", example = "100.0")
    private double value;

    @Schema(description = "Number of observations folded into this baseline", example = "12")
    private long sampleCount;

    @Schema(description = "Last update in epoch milliseconds", example = "1739886764000")
    private long updatedAt;

    public static String keyOf(MetricType metricType, String resourceId) {
        return metricType.getKey() + ":" + resourceId;
    }
}
