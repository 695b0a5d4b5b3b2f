package com.fileprovider.provider.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request to register one provider instance.
 *
 * @param alias unique name of the instance
 * @param config instance configuration; only {@code directory} is read, other keys are ignored
 * @param sourceFilePath path of the file that declared the instance, or null.
 *                       A relative {@code directory} is resolved against its parent directory.
 */
public record InitRequest(String alias, Map<String, Object> config, String sourceFilePath) {

    public static final String DIRECTORY_KEY = "directory";

    public InitRequest {
        alias = alias == null ? "" : alias;
        // values may be null when the request came from JSON
        config = config == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public InitRequest(String alias, Map<String, Object> config) {
        this(alias, config, null);
    }

    /**
     * Convenience factory for the common case of a directory-only configuration.
     */
    public static InitRequest of(String alias, String directory) {
        return new InitRequest(alias, Map.of(DIRECTORY_KEY, directory), null);
    }
}
