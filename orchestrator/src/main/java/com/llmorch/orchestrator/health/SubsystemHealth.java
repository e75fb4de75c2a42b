package com.llmorch.orchestrator.health;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of the latest probe of one subsystem.
 */
@Value
public class SubsystemHealth {
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    String status;
    Instant lastChecked;
    String message;

    public static SubsystemHealth healthy(Instant at, String message) {
        return new SubsystemHealth(HEALTHY, at, message);
    }

    public static SubsystemHealth unhealthy(Instant at, String message) {
        return new SubsystemHealth(UNHEALTHY, at, message);
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
