package io.github.cyfko.docfilter.core;

/**
 * State of the OR group of a builder.
 * <p>
 * {@code either()} moves a builder to {@link #ACTIVE_GROUP}; building moves it back to
 * {@link #NO_ACTIVE_GROUP} once the group's members have been ORed into the filter.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OrGroupState {
    NO_ACTIVE_GROUP,
    ACTIVE_GROUP
}
