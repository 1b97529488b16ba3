package com.mirrorgroups.insights.health;

import org.springframework.boot.actuate.health.Status;

/**
 * Health statuses beyond Spring Boot's built-in ones
 */
public final class InsightsHealthStatus {

    /**
     * Working, but with reduced capability
     */
    public static final Status DEGRADED = new Status("DEGRADED");

    private InsightsHealthStatus() {
    }
}
