package com.fileprovider.provider.resolution;

/**
 * How the first path segment was interpreted.
 */
public enum ResolutionMode {

    /**
     * Segment 0 is a registered alias; the file name is segment 1.
     */
    EXPLICIT,

    /**
     * Exactly one instance is registered and segment 0 is not its alias;
     * segment 0 is the file name.
     */
    IMPLICIT,

    /**
     * No instance is registered.
     */
    UNINITIALIZED,

    /**
     * Several instances are registered and segment 0 names none of them.
     */
    AMBIGUOUS
}
