package io.github.flameyossnowy.linkage.api.meta;

public enum RelationKind {
    /** The current entity holds the foreign key pointing at one target row. */
    BELONGS_TO,
    /** The target entity holds a foreign key pointing back at the current row. */
    HAS_MANY;

    public boolean isHasMany() {
        return this == HAS_MANY;
    }
}
