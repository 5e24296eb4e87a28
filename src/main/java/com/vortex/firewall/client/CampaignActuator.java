package com.vortex.firewall.client;

/**
 * Write side of the ad platform.
 */
public interface CampaignActuator {

    /**
     * Pause a campaign. Pausing an already paused campaign succeeds.
     *
     * @return true when the platform confirmed the status change
     */
    boolean pause(String campaignId);
}
