package com.fileprovider.document;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DocumentMerger}.
 */
class DocumentMergerTest {

    private static ScalarValue s(Object value) {
        return ScalarValue.of(value);
    }

    @Test
    void collidingMapsMergeRecursively() {
        MapValue alpha = MapValue.of("app", MapValue.of(Map.of("name", s("alpha"), "port", s("1111"))));
        MapValue beta = MapValue.of("app", MapValue.of(Map.of("port", s("2222"), "env", s("prod"))));

        MapValue merged = DocumentMerger.mergeAll(List.of(alpha, beta));

        MapValue expected = MapValue.of("app", MapValue.of(Map.of(
                "name", s("alpha"),
                "port", s("2222"),
                "env", s("prod"))));
        assertEquals(expected, merged);
    }

    @Test
    void oneSidedKeysPassThrough() {
        MapValue base = MapValue.of("database", MapValue.of("host", s("db1")));
        MapValue overlay = MapValue.of("network", MapValue.of("vlan", s(42)));

        MapValue merged = DocumentMerger.merge(base, overlay);

        assertEquals(2, merged.size());
        assertEquals(base.get("database"), merged.get("database"));
        assertEquals(overlay.get("network"), merged.get("network"));
    }

    @Test
    void laterScalarReplacesEarlierMap() {
        MapValue base = MapValue.of("feature", MapValue.of("enabled", s(true)));
        MapValue overlay = MapValue.of("feature", s("off"));

        assertEquals(s("off"), DocumentMerger.merge(base, overlay).get("feature").orElseThrow());
    }

    @Test
    void laterMapReplacesEarlierScalar() {
        MapValue base = MapValue.of("feature", s("off"));
        MapValue overlay = MapValue.of("feature", MapValue.of("enabled", s(true)));

        assertEquals(MapValue.of("enabled", s(true)),
                DocumentMerger.merge(base, overlay).get("feature").orElseThrow());
    }

    @Test
    void listsAreReplacedNotConcatenated() {
        MapValue base = MapValue.of("hosts", ListValue.of(s("a"), s("b")));
        MapValue overlay = MapValue.of("hosts", ListValue.of(s("c")));

        assertEquals(ListValue.of(s("c")), DocumentMerger.merge(base, overlay).get("hosts").orElseThrow());
    }

    @Test
    void inputsAreNotModified() {
        MapValue base = MapValue.of("app", MapValue.of("name", s("alpha")));
        MapValue overlay = MapValue.of("app", MapValue.of("name", s("beta")));

        DocumentMerger.merge(base, overlay);

        assertEquals(MapValue.of("app", MapValue.of("name", s("alpha"))), base);
    }

    @Test
    void mergeOfNothingIsEmpty() {
        assertEquals(MapValue.empty(), DocumentMerger.mergeAll(List.of()));
    }

    @Test
    void mergeOrderDecidesWinner() {
        MapValue first = MapValue.of("k", s("first"));
        MapValue second = MapValue.of("k", s("second"));

        assertEquals(s("second"), DocumentMerger.mergeAll(List.of(first, second)).get("k").orElseThrow());
        assertEquals(s("first"), DocumentMerger.mergeAll(List.of(second, first)).get("k").orElseThrow());
    }
}
