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
@Schema(description = "Local, per-scan copy of an ad campaign owned by the ad platform")
public class Campaign {

    @Schema(description = "Platform campaign identifier", example = "120210000000000001")
    private String id;

    @Schema(description = "Campaign display name", example = "Spring Sale - Prospecting")
    private String name;

    @Schema(description = "Lifecycle status", example = "ACTIVE")
    private CampaignStatus status;

    @Schema(description = "Daily budget in major currency units, absent when the campaign uses a lifetime budget",
            example = "150.00")
    private Double dailyBudget;

    @Schema(description = "Lifetime budget in major currency units", example = "5000.00")
    private Double lifetimeBudget;

    @Schema(description = "Campaign objective", example = "OUTCOME_SALES")
    private String objective;

    public boolean hasDailyBudget() {
        return dailyBudget != null && dailyBudget > 0;
    }
}
