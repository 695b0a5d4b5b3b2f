package com.fileprovider.config;

/**
 * Represents the lifecycle state of a {@link Component}.
 */
public enum ComponentState {

    /**
     * Component has been created but not yet configured.
     */
    UNINITIALIZED,

    /**
     * Configuration validated, ready to start.
     */
    INITIALIZED,

    /**
     * Component is serving requests.
     */
    ACTIVE,

    /**
     * All resources released, no longer operational.
     */
    STOPPED
}
