package com.vortex.firewall.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Performance of one campaign over the lookback window. Every metric is
 * nullable: a field the platform did not return stays null and rules that
 * need it abstain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSnapshot {

    private String campaignId;

    private Double spend;

    private Long impressions;

    private Long clicks;

    // Click-through rate as reported by the platform
    private Double ctr;

    // action_type -> count (link_click, purchase, ...)
    @Builder.Default
    private Map<String, Double> actions = new HashMap<>();

    private LocalDate windowStart;

    private LocalDate windowEnd;

    public boolean hasSpend() {
        return spend != null;
    }

    public boolean hasCtr() {
        return ctr != null;
    }

    public boolean hasClicks() {
        return clicks != null;
    }

    public boolean hasImpressions() {
        return impressions != null;
    }
}
