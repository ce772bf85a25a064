package io.github.flameyossnowy.linkage.api.options;

import org.jetbrains.annotations.NotNull;

/**
 * A predicate over an aggregate, applied after grouping.
 */
public record HavingFilter(@NotNull AggregateFieldDefinition aggregate, @NotNull FieldOp operation) {}
