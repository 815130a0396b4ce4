package io.github.cyfko.docfilter.core;

import io.github.cyfko.docfilter.core.config.SearchPolicy;
import io.github.cyfko.docfilter.core.model.FilterDocument;
import io.github.cyfko.docfilter.core.utils.FilterNodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the members of one OR group.
 * <p>
 * Each member is built by a {@link ChildQueryBuilder}. A member is recorded when the next one is
 * opened or when the group is flushed, provided it is not empty and not a duplicate of an earlier
 * member.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class OrQueryBuilder {

    private final SearchPolicy searchPolicy;
    private final List<FilterDocument> members = new ArrayList<>();
    private ChildQueryBuilder current;

    OrQueryBuilder(SearchPolicy searchPolicy) {
        this.searchPolicy = searchPolicy;
        this.current = new ChildQueryBuilder(this, searchPolicy);
    }

    /**
     * Records the current member and returns the builder of the next one. An empty current member
     * is reused.
     */
    ChildQueryBuilder or() {
        flush();
        return current;
    }

    /**
     * Records the current member if it holds any clause.
     *
     * @return the members recorded so far
     */
    List<FilterDocument> flush() {
        FilterDocument member = current.buildDocument();
        if (!member.isEmpty()) {
            FilterNodes.addDistinct(members, member);
            current = new ChildQueryBuilder(this, searchPolicy);
        }
        return List.copyOf(members);
    }
}
