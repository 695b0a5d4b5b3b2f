package com.fileprovider.provider;

/**
 * Category of a {@link ProviderException}, visible to callers of the service.
 */
public enum ErrorKind {

    /**
     * Malformed request: empty alias or path segment, wrong config type,
     * path too short, navigation into a non-map.
     */
    INVALID_INPUT,

    /**
     * Directory, alias, file or key does not exist.
     */
    NOT_FOUND,

    /**
     * Alias or directory already taken by a registered instance.
     */
    CONFLICT,

    /**
     * Operation needs state that is not there, e.g. a fetch with no instances registered.
     */
    FAILED_PRECONDITION,

    /**
     * File system, symlink resolution or document parsing failure.
     */
    INTERNAL
}
