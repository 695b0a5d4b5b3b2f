package com.fileprovider.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates the lifecycle of multiple {@link Component} instances.
 *
 * <p>{@code initialize()} and {@code start()} are called in registration order;
 * {@code stop()} is called in reverse registration order. When a child fails to
 * initialize or start, the children that already went through the step are
 * stopped again before the failure is rethrown.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * LifeCycleComponent lifecycle = new LifeCycleComponent("provider");
 * lifecycle.addComponent(providerService);
 * lifecycle.addComponent(providerServer);
 *
 * lifecycle.initialize();
 * lifecycle.start();
 *
 * // Later...
 * lifecycle.stop();  // providerServer first, then providerService
 * }</pre>
 */
public class LifeCycleComponent implements Component {

    private static final Logger log = LoggerFactory.getLogger(LifeCycleComponent.class);

    private final String name;
    private final List<Component> components;
    private final AtomicReference<ComponentState> state;

    /**
     * Create a new LifeCycleComponent with the given name.
     *
     * @param name the component name
     */
    public LifeCycleComponent(String name) {
        this.name = name;
        this.components = new ArrayList<>();
        this.state = new AtomicReference<>(ComponentState.UNINITIALIZED);
    }

    /**
     * Add a component to be managed.
     *
     * @param component the component to add
     * @return this instance for chaining
     */
    public LifeCycleComponent addComponent(Component component) {
        if (state.get() != ComponentState.UNINITIALIZED) {
            throw new IllegalStateException("Cannot add components after initialization");
        }
        components.add(component);
        log.debug("[{}] Added component: {}", name, component.getName());
        return this;
    }

    @Override
    public void initialize() throws Exception {
        if (!state.compareAndSet(ComponentState.UNINITIALIZED, ComponentState.INITIALIZED)) {
            throw new IllegalStateException("Cannot initialize from state: " + state.get());
        }

        log.info("[{}] Initializing {} components", name, components.size());

        for (int i = 0; i < components.size(); i++) {
            Component component = components.get(i);
            try {
                component.initialize();
            } catch (Exception e) {
                log.error("[{}] Failed to initialize component: {}", name, component.getName(), e);
                stopFirst(i);
                state.set(ComponentState.STOPPED);
                throw e;
            }
        }
    }

    @Override
    public void start() throws Exception {
        ComponentState currentState = state.get();
        if (currentState != ComponentState.INITIALIZED) {
            throw new IllegalStateException("Cannot start from state: " + currentState);
        }

        log.info("[{}] Starting {} components", name, components.size());

        for (int i = 0; i < components.size(); i++) {
            Component component = components.get(i);
            try {
                component.start();
            } catch (Exception e) {
                log.error("[{}] Failed to start component: {}", name, component.getName(), e);
                // the failing component may hold half-acquired resources too
                stopFirst(i + 1);
                state.set(ComponentState.STOPPED);
                throw e;
            }
        }

        state.set(ComponentState.ACTIVE);
        log.info("[{}] All components started", name);
    }

    @Override
    public void stop() {
        ComponentState currentState = state.getAndSet(ComponentState.STOPPED);
        if (currentState == ComponentState.STOPPED) {
            log.debug("[{}] Already stopped", name);
            return;
        }

        log.info("[{}] Stopping {} components", name, components.size());
        stopFirst(components.size());
        log.info("[{}] All components stopped", name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ComponentState getState() {
        return state.get();
    }

    /**
     * Stop the first {@code count} components in reverse order.
     */
    private void stopFirst(int count) {
        for (int i = count - 1; i >= 0; i--) {
            Component component = components.get(i);
            log.debug("[{}] Stopping component: {}", name, component.getName());
            try {
                component.stop();
            } catch (Exception e) {
                log.error("[{}] Error stopping component: {}", name, component.getName(), e);
            }
        }
    }
}
