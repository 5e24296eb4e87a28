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
@Schema(description = "Outcome of one scan cycle over the ad account")
public class ScanSummary {

    @Schema(description = "Scan identifier", example = "9b7d0d38-5c4f-4a3b-8f1e-0d7d2f6f1a22")
    private String scanId;

    @Schema(description = "Start time in epoch milliseconds", example = "1739886764000")
    private long startedAt;

    @Schema(description = "End time in epoch milliseconds", example = "1739886766000")
    private long finishedAt;

    @Schema(description = "Campaigns returned by the platform", example = "12")
    private int campaignsListed;

    @Schema(description = "Campaigns fully processed", example = "11")
    private int campaignsScanned;

    @Schema(description = "Campaigns skipped because of an error", example = "1")
    private int campaignsFailed;

    @Schema(description = "Findings produced", example = "2")
    private int findings;

    @Schema(description = "Automatic pauses attempted", example = "1")
    private int pausesRequested;

    @Schema(description = "Automatic pauses confirmed by the platform", example = "1")
    private int pausesSucceeded;

    @Schema(description = "True when the campaign list could not be fetched", example = "false")
    private boolean aborted;

    @Schema(description = "True when a shutdown request ended the scan before all campaigns were processed",
            example = "false")
    private boolean stoppedEarly;

    @Schema(description = "Why the scan was aborted", example = "Meta API request failed: act_123/campaigns")
    private String abortReason;
}
