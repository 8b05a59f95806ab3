package com.example.cachesync.coalesce;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CallSignatureTest {

    @Test
    void testParameterOrderDoesNotMatter() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("bookId", 3);
        first.put("query", "dragon");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("query", "dragon");
        second.put("bookId", 3);

        assertEquals(CallSignature.of("search", first), CallSignature.of("search", second));
    }

    @Test
    void testNestedMapsAreCanonical() {
        Map<String, Object> innerA = new LinkedHashMap<>();
        innerA.put("z", 1);
        innerA.put("a", 2);
        Map<String, Object> innerB = new LinkedHashMap<>();
        innerB.put("a", 2);
        innerB.put("z", 1);

        assertEquals(CallSignature.of("op", Map.of("filter", innerA)).value(),
            CallSignature.of("op", Map.of("filter", innerB)).value());
    }

    @Test
    void testDistinguishesOperationAndValues() {
        assertNotEquals(CallSignature.of("getBook", Map.of("id", 1)), CallSignature.of("getChapter", Map.of("id", 1)));
        assertNotEquals(CallSignature.of("getBook", Map.of("id", 1)), CallSignature.of("getBook", Map.of("id", 2)));
    }

    @Test
    void testEmptyAndNullParamsAreEquivalent() {
        assertEquals(CallSignature.of("getBooks", null), CallSignature.of("getBooks", Map.of()));
        assertEquals("getBooks{}", CallSignature.of("getBooks", null).value());
    }
}
