package io.github.flameyossnowy.linkage.api.options;

public enum QueryMode {
    DEFAULT,
    /** Case-insensitive string comparison. */
    INSENSITIVE
}
