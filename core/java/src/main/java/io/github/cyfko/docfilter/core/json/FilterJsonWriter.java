package io.github.cyfko.docfilter.core.json;

import io.github.cyfko.docfilter.core.exception.FilterRenderException;
import io.github.cyfko.docfilter.core.model.FilterDocument;
import org.bson.Document;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

import java.util.Objects;

/**
 * Renders filters as MongoDB Extended JSON (relaxed mode), the notation of the document store's
 * shell and drivers.
 * <p>
 * The filter is handed to the BSON library as a {@link Document}, so every literal is written the
 * way the store itself would write it:
 * </p>
 * <ul>
 *   <li>{@link java.util.regex.Pattern} → {@code {"$regularExpression": {"pattern": "...", "options": "i"}}}</li>
 *   <li>{@link java.util.Date} → {@code {"$date": "2017-03-28T00:00:00Z"}}</li>
 *   <li>{@code NaN} and infinities → {@code {"$numberDouble": "NaN"}}</li>
 * </ul>
 *
 * <pre>{@code
 * String json = FilterJsonWriter.write(new QueryBuilder().field("age").is("$gt", 18).buildDocument());
 * // {"age": {"$gt": 18}}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterJsonWriter {

    private static final JsonWriterSettings SETTINGS = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .build();

    private FilterJsonWriter() {}

    /**
     * @param filter the filter to render
     * @return the filter as a single-line JSON string
     * @throws FilterRenderException if a literal of the filter has no BSON representation
     */
    public static String write(FilterDocument filter) {
        Objects.requireNonNull(filter, "Filter cannot be null");
        try {
            return new Document(filter.toRaw()).toJson(SETTINGS);
        } catch (CodecConfigurationException e) {
            throw new FilterRenderException("Unable to render filter as JSON: " + filter, e);
        }
    }
}
