package io.github.flameyossnowy.linkage.api.options;

/**
 * Placement of NULL values in an ordered result.
 */
public enum NullsOrder {
    FIRST,
    LAST;

    public NullsOrder reverse() {
        return this == FIRST ? LAST : FIRST;
    }
}
