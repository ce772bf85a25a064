package io.github.flameyossnowy.linkage.api.options;

/**
 * How a condition over a has-many relation is quantified over the related rows.
 */
public enum RelationQuantifier {
    /** At least one related row matches. */
    SOME,
    /** Every related row matches (vacuously true when there are none). */
    EVERY,
    /** No related row matches. */
    NONE
}
