package com.vortex.firewall.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Urgent alerts carry a request for immediate review.
     */
    public boolean isUrgent() {
        return this == HIGH || this == CRITICAL;
    }
}
