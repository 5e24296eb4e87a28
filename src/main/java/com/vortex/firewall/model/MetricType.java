package com.vortex.firewall.model;

/**
 * Metrics tracked in the baseline store. The key is the stored identifier and
 * must stay stable across releases.
 */
public enum MetricType {
    DAILY_SPEND("daily_spend"),
    CTR("ctr"),
    CLICKS("clicks"),
    IMPRESSIONS("impressions");

    private final String key;

    MetricType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static MetricType fromKey(String key) {
        for (MetricType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown metric type: " + key);
    }
}
