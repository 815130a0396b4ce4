package io.github.cyfko.docfilter.core.model;

/**
 * A node of a document-store filter tree.
 * <p>
 * A filter tree is made of three kinds of nodes, each one an immutable value:
 * </p>
 * <ul>
 *   <li>{@link FilterDocument}: an ordered mapping from key to node. Keys are either document field
 *       names, comparison operators ({@code $gt}, {@code $in}, {@code $regex}, ...) or the boolean
 *       combinators {@code $and} / {@code $or}.</li>
 *   <li>{@link FilterList}: an ordered sequence of nodes, e.g. the members of an {@code $or} or the
 *       candidate values of an {@code $in}.</li>
 *   <li>{@link FilterValue}: a literal, compared by implicit equality.</li>
 * </ul>
 *
 * <h2>Structural Equality</h2>
 * <p>
 * Two nodes describe the same clause if and only if they are {@code equals}. Equality is recursive,
 * order-sensitive for lists and order-insensitive for document keys. Deduplication of {@code $and},
 * {@code $or} and {@code $in} entries relies solely on this equality.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.docfilter.core.utils.FilterNodes
 */
public interface FilterNode {

    /**
     * Converts this node back into the plain Java shape consumed by document-store drivers:
     * {@code Map<String, Object>} for documents, {@code List<Object>} for lists and the wrapped
     * object for literals.
     *
     * @return a freshly allocated, mutable plain representation of this node
     */
    Object toRaw();
}
