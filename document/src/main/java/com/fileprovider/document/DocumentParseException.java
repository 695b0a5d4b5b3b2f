package com.fileprovider.document;

import java.nio.file.Path;

/**
 * Thrown when a configuration file cannot be read or parsed.
 */
public class DocumentParseException extends Exception {

    private final Path file;

    public DocumentParseException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    /**
     * @return the file that failed to parse
     */
    public Path getFile() {
        return file;
    }
}
