package com.fileprovider.config;

/**
 * Lifecycle interface for long-lived parts of the provider process.
 *
 * <p>Components move through the following states:</p>
 * <pre>
 * UNINITIALIZED ──► INITIALIZED ──► ACTIVE
 *        │               │            │
 *        └───────────────┴────────────┴──► STOPPED
 * </pre>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Component server = ...;
 * server.initialize();   // Validate configuration, build routes
 * server.start();        // Begin serving requests
 * server.stop();         // Release resources
 * }</pre>
 */
public interface Component {

    /**
     * Initialize the component.
     * Transitions from UNINITIALIZED to INITIALIZED.
     *
     * @throws Exception if initialization fails
     */
    void initialize() throws Exception;

    /**
     * Start processing requests.
     * Transitions from INITIALIZED to ACTIVE.
     *
     * @throws Exception if start fails
     */
    void start() throws Exception;

    /**
     * Stop the component and release all resources.
     * Transitions to STOPPED from any state. Calling it twice is a no-op.
     */
    void stop();

    /**
     * Get the component name.
     *
     * @return the component name
     */
    String getName();

    /**
     * Get the current component state.
     *
     * @return the current state
     */
    ComponentState getState();

    /**
     * Check if the component is in active state.
     *
     * @return true if active
     */
    default boolean isActive() {
        return getState() == ComponentState.ACTIVE;
    }
}
