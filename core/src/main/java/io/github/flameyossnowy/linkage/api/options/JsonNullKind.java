package io.github.flameyossnowy.linkage.api.options;

public enum JsonNullKind {
    /** SQL NULL in the column. */
    DB_NULL,
    /** A stored JSON {@code null} literal. */
    JSON_NULL,
    /** Either of the above. */
    ANY_NULL
}
