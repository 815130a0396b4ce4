package io.github.cyfko.docfilter.core;

import io.github.cyfko.docfilter.core.compose.FilterComposer;

import java.util.Collections;
import java.util.List;

/**
 * Builds constraints on one document field.
 * <p>
 * Every method adds its constraint to the parent builder and returns the parent; use
 * {@link BaseQueryBuilder#andField()} to come back to this field.
 * </p>
 *
 * @param <B> type of the parent builder
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FieldQueryBuilder<B extends BaseQueryBuilder<B>> {

    private final B parent;
    private final String field;

    FieldQueryBuilder(B parent, String field) {
        FilterComposer.requireField(field);
        this.parent = parent;
        this.field = field;
    }

    public String field() {
        return field;
    }

    /**
     * Compares the field with a value.
     *
     * @param comparator the operator, e.g. {@code "$gt"}, {@code "$gte"}, {@code "$regex"}
     * @param value      the operand
     * @return the parent builder
     */
    public B is(String comparator, Object value) {
        return parent.compare(field, comparator, value);
    }

    /**
     * Requires the field to match {@code value}; same as {@code matchesAll(List.of(value))}.
     */
    public B matches(Object value) {
        return parent.matchesAll(field, Collections.singletonList(value));
    }

    /**
     * Requires the field to match every one of {@code values}.
     */
    public B matchesAll(List<?> values) {
        return parent.matchesAll(field, values);
    }

    /**
     * Requires the field to match at least one of {@code values}.
     */
    public B matchesAny(List<?> values) {
        return matchesAny(values, false);
    }

    /**
     * Requires the field to match at least one of {@code values}.
     *
     * @param values          the accepted values
     * @param addToExistingOr if true, the values join the field's existing {@code $in} list, if any
     * @return the parent builder
     */
    public B matchesAny(List<?> values, boolean addToExistingOr) {
        return parent.matchesAny(field, values, addToExistingOr);
    }
}
