package com.vortex.firewall.model;

/**
 * How a new observation is folded into a stored baseline.
 */
public enum BaselineMode {
    // Last observation wins
    REPLACE,
    // Exponentially weighted: alpha * observation + (1 - alpha) * previous
    MOVING_AVERAGE
}
