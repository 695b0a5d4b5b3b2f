package com.fileprovider.provider.registry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable committed state of an {@link InstanceRegistry}.
 *
 * <p>The three views are always consistent with each other: every alias in
 * {@code order} has exactly one entry in {@code instances}, and
 * {@code directoryIndex} maps each instance's directory back to its alias.</p>
 *
 * @param instances alias to instance
 * @param directoryIndex canonical directory to owning alias
 * @param order aliases in commit order
 */
public record RegistrySnapshot(Map<String, ProviderInstance> instances,
                               Map<Path, String> directoryIndex,
                               List<String> order) {

    private static final RegistrySnapshot EMPTY = new RegistrySnapshot(Map.of(), Map.of(), List.of());

    public RegistrySnapshot {
        instances = Collections.unmodifiableMap(new LinkedHashMap<>(instances));
        directoryIndex = Collections.unmodifiableMap(new HashMap<>(directoryIndex));
        order = List.copyOf(order);
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    /**
     * New snapshot with the given instance appended.
     */
    RegistrySnapshot with(ProviderInstance instance) {
        Map<String, ProviderInstance> nextInstances = new LinkedHashMap<>(instances);
        nextInstances.put(instance.alias(), instance);
        Map<Path, String> nextIndex = new HashMap<>(directoryIndex);
        nextIndex.put(instance.directory(), instance.alias());
        List<String> nextOrder = new ArrayList<>(order);
        nextOrder.add(instance.alias());
        return new RegistrySnapshot(nextInstances, nextIndex, nextOrder);
    }

    public Optional<ProviderInstance> lookup(String alias) {
        return Optional.ofNullable(instances.get(alias));
    }

    public Optional<String> owner(Path canonicalDirectory) {
        return Optional.ofNullable(directoryIndex.get(canonicalDirectory));
    }

    /**
     * @return the only registered instance, if exactly one is registered
     */
    public Optional<ProviderInstance> soleInstance() {
        return instances.size() == 1
                ? Optional.of(instances.values().iterator().next())
                : Optional.empty();
    }

    public int size() {
        return instances.size();
    }

    public boolean isEmpty() {
        return instances.isEmpty();
    }
}
