package com.fileprovider.provider;

/**
 * Result of a health check.
 *
 * @param status the health status
 * @param message human-readable detail
 */
public record HealthReport(HealthStatus status, String message) {

    static HealthReport healthy() {
        return new HealthReport(HealthStatus.OK, "healthy");
    }

    static HealthReport noInstances() {
        return new HealthReport(HealthStatus.DEGRADED, "no instances initialized");
    }
}
