package io.github.cyfko.docfilter.core;

import io.github.cyfko.docfilter.core.config.SearchPolicy;
import io.github.cyfko.docfilter.core.model.FilterDocument;

/**
 * Builder of one member of an OR group, spawned by {@link BaseQueryBuilder#either()}.
 * <p>
 * Clauses added to a child are ANDed together, and the resulting document becomes one alternative
 * of the group.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ChildQueryBuilder extends BaseQueryBuilder<ChildQueryBuilder> {

    private final OrQueryBuilder parentOr;

    ChildQueryBuilder(OrQueryBuilder parentOr, SearchPolicy searchPolicy) {
        super(FilterDocument.empty(), searchPolicy);
        this.parentOr = parentOr;
    }

    /**
     * Closes this member of the OR group and continues with the next one.
     *
     * @return the builder of the next member of the group
     */
    public ChildQueryBuilder or() {
        return parentOr.or();
    }

    @Override
    protected ChildQueryBuilder self() {
        return this;
    }
}
