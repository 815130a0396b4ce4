package io.github.cyfko.docfilter.core.config;

/**
 * Reserved keys of the document-store filter dialect.
 * <p>
 * The boolean combinators take a list of filter documents; the comparison operators appear inside
 * the predicate document of a single field, e.g. {@code {age: {$gte: 18, $lt: 65}}}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterOperators {

    /** Conjunction of a list of filter documents. */
    public static final String AND = "$and";

    /** Disjunction of a list of filter documents. */
    public static final String OR = "$or";

    /** Set membership: the field matches one of the listed values. */
    public static final String IN = "$in";

    /** Regular expression match on a string field. */
    public static final String REGEX = "$regex";

    public static final String EQ = "$eq";
    public static final String NE = "$ne";
    public static final String GT = "$gt";
    public static final String GTE = "$gte";
    public static final String LT = "$lt";
    public static final String LTE = "$lte";
    public static final String NIN = "$nin";
    public static final String EXISTS = "$exists";
}
