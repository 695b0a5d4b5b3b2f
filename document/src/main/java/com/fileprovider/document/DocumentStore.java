package com.fileprovider.document;

import java.nio.file.Path;
import java.util.List;

/**
 * Parses configuration files into {@link Document} trees.
 *
 * <p>Implementations must not cache: every call reads the file again. They must
 * be safe for concurrent use from request threads.</p>
 */
public interface DocumentStore {

    /**
     * File name suffixes this store can parse, including the leading dot.
     * Matching against file names is case-insensitive.
     *
     * @return the recognized extensions, never empty
     */
    List<String> fileExtensions();

    /**
     * Parse the file at the given absolute path.
     *
     * @param file absolute path of the file
     * @return the top-level mapping of the file
     * @throws DocumentParseException if the file cannot be read or is not valid
     */
    MapValue parse(Path file) throws DocumentParseException;
}
