package com.vortex.firewall.model;

public enum CampaignStatus {
    ACTIVE,
    PAUSED,
    DELETED,
    ARCHIVED,
    UNKNOWN;

    public static CampaignStatus fromApiValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        try {
            return CampaignStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
