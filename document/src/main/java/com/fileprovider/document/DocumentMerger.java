package com.fileprovider.document;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deep merge of documents.
 *
 * <p>Merging {@code base} with {@code overlay}:</p>
 * <ul>
 *   <li>keys present on one side only are kept unchanged</li>
 *   <li>keys present on both sides whose values are both maps are merged recursively</li>
 *   <li>any other collision takes the overlay value</li>
 * </ul>
 */
public final class DocumentMerger {

    private DocumentMerger() {}

    /**
     * Fold the given maps left to right: each later map overlays the accumulated result.
     *
     * @param documents maps in merge order
     * @return the merged map, empty if no documents are given
     */
    public static MapValue mergeAll(List<MapValue> documents) {
        MapValue accumulator = MapValue.empty();
        for (MapValue document : documents) {
            accumulator = merge(accumulator, document);
        }
        return accumulator;
    }

    /**
     * Merge two maps, the overlay winning on non-map collisions.
     */
    public static MapValue merge(MapValue base, MapValue overlay) {
        TreeMap<String, Document> merged = new TreeMap<>(base.entries());
        for (Map.Entry<String, Document> entry : overlay.entries().entrySet()) {
            Document existing = merged.get(entry.getKey());
            merged.put(entry.getKey(), existing == null ? entry.getValue() : merge(existing, entry.getValue()));
        }
        return new MapValue(merged);
    }

    private static Document merge(Document base, Document overlay) {
        return switch (overlay.kind()) {
            case MAP -> base.isMap() ? merge((MapValue) base, (MapValue) overlay) : overlay;
            case LIST, SCALAR -> overlay;
        };
    }
}
