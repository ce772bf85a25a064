package io.github.flameyossnowy.linkage.api.options;

/**
 * Aggregate functions usable in aggregate and group-by queries.
 */
public enum AggregationType {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX
}
