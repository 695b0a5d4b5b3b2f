package com.fileprovider.provider.registry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One registered configuration directory.
 *
 * <p>Immutable: a rescan of the directory produces a new instance.</p>
 *
 * @param alias unique instance name
 * @param directory canonical absolute path of the directory
 * @param files base name (file name without extension) to absolute file path, sorted by base name
 * @param ready true once registration has committed
 */
public record ProviderInstance(String alias, Path directory, SortedMap<String, Path> files, boolean ready) {

    public ProviderInstance {
        files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
    }

    /**
     * Look up a file by base name.
     */
    public Optional<Path> file(String baseName) {
        return Optional.ofNullable(files.get(baseName));
    }

    /**
     * @return base names in ascending lexicographic order
     */
    public List<String> baseNames() {
        return new ArrayList<>(files.keySet());
    }
}
