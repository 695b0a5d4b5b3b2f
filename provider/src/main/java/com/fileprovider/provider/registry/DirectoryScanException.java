package com.fileprovider.provider.registry;

/**
 * Thrown when a configuration directory cannot be turned into a file index.
 */
public class DirectoryScanException extends Exception {

    public DirectoryScanException(String message) {
        super(message);
    }

    public DirectoryScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
