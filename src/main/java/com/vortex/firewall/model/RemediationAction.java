package com.vortex.firewall.model;

public enum RemediationAction {
    ALERT_ONLY,
    ALERT_AND_PAUSE
}
