package io.github.flameyossnowy.linkage.api.options;

/**
 * One projected expression: {@code column AS alias}.
 */
public record ColumnSelection(String column, String alias) {}
