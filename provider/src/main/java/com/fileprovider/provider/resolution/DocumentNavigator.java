package com.fileprovider.provider.resolution;

import com.fileprovider.document.Document;
import com.fileprovider.document.MapValue;
import com.fileprovider.provider.ProviderException;

/**
 * Walks the nested part of a fetch path through a document.
 */
final class DocumentNavigator {

    private DocumentNavigator() {}

    /**
     * Descend from {@code root} through {@code path} starting at segment {@code start}.
     *
     * @param root the resolved file (or merged) document
     * @param path the full fetch path, used for segments and error messages
     * @param start index of the first nested segment
     * @param fileName file segment, for error messages
     * @param alias instance alias, for error messages
     * @return the value addressed by the path
     */
    static Document navigate(MapValue root, FetchPath path, int start, String fileName, String alias) {
        Document current = root;
        for (int i = start; i < path.size(); i++) {
            String key = path.segment(i);

            // only a trailing wildcard is special; elsewhere "*" is an ordinary key
            if (FetchPath.isWildcard(key) && i == path.size() - 1) {
                if (!current.isMap()) {
                    throw ProviderException.invalidInput(String.format(
                            "cannot expand path %s: value before wildcard at index %d is not a map", path, i));
                }
                return current;
            }

            if (!(current instanceof MapValue map)) {
                throw ProviderException.invalidInput(String.format(
                        "cannot navigate to path %s: element at index %d is not a map", path, i));
            }
            current = map.get(key).orElseThrow(() -> ProviderException.notFound(String.format(
                    "path element \"%s\" not found in file \"%s\" (provider instance \"%s\")",
                    key, fileName, alias)));
        }
        return current;
    }
}
