package io.github.cyfko.docfilter.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.docfilter.core.config.FilterOperators;
import io.github.cyfko.docfilter.core.exception.FilterRenderException;
import io.github.cyfko.docfilter.core.model.FilterDocument;
import io.github.cyfko.docfilter.core.model.FilterList;
import io.github.cyfko.docfilter.core.model.FilterValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterJsonWriter Tests")
class FilterJsonWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Should render plain values in key order")
    void shouldRenderPlainValues() {
        FilterDocument filter = FilterDocument.of("age", FilterDocument.of(FilterOperators.GT, FilterValue.of(18)))
                .with("tags", FilterDocument.of(FilterOperators.IN, FilterList.of(FilterValue.of("a"), FilterValue.of(null))));

        assertEquals("{\"age\": {\"$gt\": 18}, \"tags\": {\"$in\": [\"a\", null]}}", FilterJsonWriter.write(filter));
    }

    @Test
    @DisplayName("Should render conjunctions and disjunctions as arrays of documents")
    void shouldRenderCombinators() {
        FilterDocument filter = FilterDocument.of(FilterOperators.AND, FilterList.of(
                FilterDocument.of(FilterOperators.OR, FilterList.of(
                        FilterDocument.of("a", FilterValue.of(1)),
                        FilterDocument.of("b", FilterValue.of(2))))));

        assertEquals("{\"$and\": [{\"$or\": [{\"a\": 1}, {\"b\": 2}]}]}", FilterJsonWriter.write(filter));
    }

    @Test
    @DisplayName("Should render patterns as regular expressions with their options")
    void shouldRenderPatterns() throws Exception {
        FilterDocument filter = FilterDocument.of("title",
                FilterDocument.of(FilterOperators.REGEX, FilterValue.of(Pattern.compile("pot", Pattern.CASE_INSENSITIVE))));

        JsonNode regex = MAPPER.readTree(FilterJsonWriter.write(filter))
                .path("title").path("$regex").path("$regularExpression");

        assertEquals("pot", regex.path("pattern").asText());
        assertEquals("i", regex.path("options").asText());
    }

    @Test
    @DisplayName("Should render dates as Extended JSON dates")
    void shouldRenderDates() throws Exception {
        FilterDocument filter = FilterDocument.of("created", FilterValue.of(new Date(0)));

        JsonNode date = MAPPER.readTree(FilterJsonWriter.write(filter)).path("created").path("$date");

        assertTrue(date.isTextual());
        assertTrue(date.asText().startsWith("1970-01-01T00:00:00"));
    }

    @Test
    @DisplayName("Should render numbers without a JSON counterpart in Extended JSON")
    void shouldRenderSpecialNumbers() throws Exception {
        FilterDocument filter = FilterDocument.of("score", FilterValue.of(Double.NaN))
                .with("views", FilterValue.of(5_000_000_000L));

        JsonNode json = MAPPER.readTree(FilterJsonWriter.write(filter));

        assertEquals("NaN", json.path("score").path("$numberDouble").asText());
        assertEquals(5_000_000_000L, json.path("views").asLong());
    }

    @Test
    @DisplayName("Should wrap values without a BSON representation")
    void shouldWrapFailures() {
        FilterDocument filter = FilterDocument.of("opaque", FilterValue.of(new Object()));

        FilterRenderException ex = assertThrows(FilterRenderException.class, () -> FilterJsonWriter.write(filter));
        assertNotNull(ex.getCause());
        assertTrue(ex.getMessage().contains("opaque"));
    }
}
