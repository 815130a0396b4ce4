package io.github.cyfko.docfilter.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Filter node model Tests")
class FilterDocumentTest {

    private static FilterDocument sample() {
        Map<String, FilterNode> entries = new LinkedHashMap<>();
        entries.put("b", FilterValue.of(1));
        entries.put("a", FilterDocument.of("$gt", FilterValue.of(2)));
        return FilterDocument.of(entries);
    }

    @Test
    @DisplayName("Should ignore key order in equality but keep it for iteration")
    void shouldIgnoreKeyOrderInEquality() {
        FilterDocument reversed = FilterDocument.of("a", FilterDocument.of("$gt", FilterValue.of(2)))
                .with("b", FilterValue.of(1));

        assertEquals(sample(), reversed);
        assertEquals(sample().hashCode(), reversed.hashCode());
        assertEquals(List.of("b", "a"), new ArrayList<>(sample().keys()));
        assertEquals(List.of("a", "b"), new ArrayList<>(reversed.keys()));
    }

    @Test
    @DisplayName("Should keep the position of a replaced key and append new keys")
    void shouldKeepPositionOnReplace() {
        FilterDocument updated = sample().with("b", FilterValue.of(5)).with("c", FilterValue.of(6));

        assertEquals(List.of("b", "a", "c"), new ArrayList<>(updated.keys()));
        assertEquals(FilterValue.of(5), updated.get("b"));
    }

    @Test
    @DisplayName("Should return new documents from with() and without()")
    void shouldBeImmutable() {
        FilterDocument original = sample();

        FilterDocument removed = original.without("a");

        assertEquals(2, original.size());
        assertEquals(1, removed.size());
        assertSame(original, original.without("missing"));
        assertTrue(original.without("a").without("b").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> original.entries().remove("a"));
    }

    @Test
    @DisplayName("Should convert to a mutable plain map")
    void shouldConvertToRaw() {
        Map<String, Object> raw = sample().toRaw();

        assertEquals(Map.of("b", 1, "a", Map.of("$gt", 2)), raw);
        raw.put("c", 3);
        assertFalse(sample().containsKey("c"));
    }

    @Test
    @DisplayName("Should reject null keys and values")
    void shouldRejectNulls() {
        assertThrows(NullPointerException.class, () -> FilterDocument.of(null, FilterValue.of(1)));
        assertThrows(NullPointerException.class, () -> FilterDocument.of("a", null));
    }

    @Test
    @DisplayName("Should compare lists in order and union them without duplicates")
    void shouldHandleLists() {
        FilterList first = FilterList.of(FilterValue.of(1), FilterValue.of(2));
        FilterList second = FilterList.of(FilterValue.of(2), FilterValue.of(3));

        assertNotEquals(first, FilterList.of(FilterValue.of(2), FilterValue.of(1)));
        assertEquals(FilterList.of(FilterValue.of(1), FilterValue.of(2), FilterValue.of(3)), first.union(second));
        assertSame(first, first.union(FilterList.of(FilterValue.of(1))));
        assertTrue(first.contains(FilterValue.of(2)));
        assertFalse(first.contains(FilterValue.of(3)));
        assertEquals(List.of(1, 2), first.toRaw());
    }

    @Test
    @DisplayName("Should compare patterns by source and flags")
    void shouldComparePatterns() {
        FilterValue p1 = FilterValue.of(Pattern.compile("abc", Pattern.CASE_INSENSITIVE));
        FilterValue p2 = FilterValue.of(Pattern.compile("abc", Pattern.CASE_INSENSITIVE));
        FilterValue p3 = FilterValue.of(Pattern.compile("abc"));

        assertEquals(p1, p2);
        assertEquals(p1.hashCode(), p2.hashCode());
        assertNotEquals(p1, p3);
        assertEquals(FilterValue.of(null), FilterValue.of(null));
    }

    @Test
    @DisplayName("Should compare integral numbers by value")
    void shouldCompareIntegralNumbers() {
        assertEquals(FilterValue.of(18), FilterValue.of(18L));
        assertEquals(FilterValue.of(18).hashCode(), FilterValue.of(18L).hashCode());
        assertEquals(FilterValue.of(-1), FilterValue.of((short) -1));
        assertEquals(FilterValue.of(-1).hashCode(), FilterValue.of((short) -1).hashCode());
        assertNotEquals(FilterValue.of(18), FilterValue.of(18.0));
        assertNotEquals(FilterValue.of(18), FilterValue.of("18"));
        assertEquals(FilterList.of(FilterValue.of(1), FilterValue.of(2)),
                FilterList.of(FilterValue.of(1L)).union(FilterList.of(FilterValue.of(1), FilterValue.of(2L))));
    }

    @Test
    @DisplayName("Should print patterns with their option letters")
    void shouldPrintPatternOptions() {
        assertEquals("/pot/i", FilterValue.of(Pattern.compile("pot", Pattern.CASE_INSENSITIVE)).toString());
        assertEquals("/a.b/ms", FilterValue.of(Pattern.compile("a.b", Pattern.DOTALL | Pattern.MULTILINE)).toString());
        assertEquals("/x/", FilterValue.of(Pattern.compile("x")).toString());
        assertEquals("{title: {$regex: /pot/i}}",
                FilterDocument.of("title", FilterDocument.of("$regex",
                        FilterValue.of(Pattern.compile("pot", Pattern.CASE_INSENSITIVE)))).toString());
    }
}
