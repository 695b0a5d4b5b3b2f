package com.fileprovider.provider;

/**
 * Health of the provider.
 */
public enum HealthStatus {
    /** At least one instance is registered. */
    OK,
    /** No instance is registered. */
    DEGRADED
}
