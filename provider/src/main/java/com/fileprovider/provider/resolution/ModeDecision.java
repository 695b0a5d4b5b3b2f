package com.fileprovider.provider.resolution;

import com.fileprovider.provider.registry.ProviderInstance;

/**
 * Outcome of {@link ModeDetector#detect}.
 *
 * @param mode the detected mode
 * @param instance the addressed instance for {@code EXPLICIT} and {@code IMPLICIT}, otherwise null
 * @param fileNameIndex index of the file name segment for {@code EXPLICIT} and {@code IMPLICIT}, otherwise -1
 */
public record ModeDecision(ResolutionMode mode, ProviderInstance instance, int fileNameIndex) {

    static ModeDecision explicit(ProviderInstance instance) {
        return new ModeDecision(ResolutionMode.EXPLICIT, instance, 1);
    }

    static ModeDecision implicit(ProviderInstance instance) {
        return new ModeDecision(ResolutionMode.IMPLICIT, instance, 0);
    }

    static ModeDecision of(ResolutionMode mode) {
        return new ModeDecision(mode, null, -1);
    }
}
