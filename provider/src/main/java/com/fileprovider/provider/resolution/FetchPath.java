package com.fileprovider.provider.resolution;

import com.fileprovider.provider.ProviderException;

import java.util.List;

/**
 * Validated request path of a fetch.
 *
 * <p>Non-empty, and no segment is empty. Segment 0 is an alias, a file base name
 * or the {@link #WILDCARD} token.</p>
 *
 * @param segments the path segments
 */
public record FetchPath(List<String> segments) {

    /**
     * Reserved segment. As a file name it merges all files of an instance;
     * as the last nested segment it returns the current map as-is. Any other
     * nested occurrence is looked up as a literal key.
     */
    public static final String WILDCARD = "*";

    public FetchPath {
        segments = List.copyOf(segments);
    }

    /**
     * Validate and wrap a raw path.
     *
     * @throws ProviderException with {@code INVALID_INPUT} if the path is empty or has an empty segment
     */
    public static FetchPath of(List<String> segments) {
        if (segments == null || segments.isEmpty()) {
            throw ProviderException.invalidInput("path cannot be empty");
        }
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (segment == null || segment.isEmpty()) {
                throw ProviderException.invalidInput("path[" + i + "] cannot be empty");
            }
        }
        return new FetchPath(segments);
    }

    public static FetchPath of(String... segments) {
        return of(List.of(segments));
    }

    public String segment(int index) {
        return segments.get(index);
    }

    public String first() {
        return segments.get(0);
    }

    public int size() {
        return segments.size();
    }

    public static boolean isWildcard(String segment) {
        return WILDCARD.equals(segment);
    }

    @Override
    public String toString() {
        return segments.toString();
    }
}
