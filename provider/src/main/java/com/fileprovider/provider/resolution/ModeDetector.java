package com.fileprovider.provider.resolution;

import com.fileprovider.provider.registry.ProviderInstance;
import com.fileprovider.provider.registry.RegistrySnapshot;

/**
 * Decides how a fetch path addresses the registry.
 *
 * <p>Total over all snapshots and non-empty paths: the alias test comes first,
 * then the instance count.</p>
 */
public final class ModeDetector {

    private ModeDetector() {}

    public static ModeDecision detect(RegistrySnapshot snapshot, FetchPath path) {
        ProviderInstance byAlias = snapshot.lookup(path.first()).orElse(null);
        if (byAlias != null) {
            return ModeDecision.explicit(byAlias);
        }
        return switch (snapshot.size()) {
            case 0 -> ModeDecision.of(ResolutionMode.UNINITIALIZED);
            case 1 -> ModeDecision.implicit(snapshot.soleInstance().orElseThrow());
            default -> ModeDecision.of(ResolutionMode.AMBIGUOUS);
        };
    }
}
