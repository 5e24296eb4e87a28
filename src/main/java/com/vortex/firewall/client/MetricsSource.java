package com.vortex.firewall.client;

import com.vortex.firewall.model.Campaign;
import com.vortex.firewall.model.MetricSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the ad platform.
 */
public interface MetricsSource {

    /**
     * Campaigns of the ad account that should be scanned.
     *
     * @throws MetaApiException when the platform cannot be reached or rejects the call
     */
    List<Campaign> listActiveCampaigns(String accountId);

    /**
     * Performance of one campaign between {@code windowStart} and {@code windowEnd} (inclusive).
     * Fields the platform does not return are left null in the snapshot.
     *
     * @return empty when the platform has no insights for the window
     * @throws MetaApiException when the platform cannot be reached or rejects the call
     */
    Optional<MetricSnapshot> getInsights(String campaignId, List<String> fields,
                                         LocalDate windowStart, LocalDate windowEnd);
}
