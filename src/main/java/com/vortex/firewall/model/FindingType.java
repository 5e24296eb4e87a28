package com.vortex.firewall.model;

public enum FindingType {
    SPENDING_SPIKE,
    CTR_ANOMALY,
    HIGH_CLICK_VOLUME,
    BUDGET_BREACH
}
