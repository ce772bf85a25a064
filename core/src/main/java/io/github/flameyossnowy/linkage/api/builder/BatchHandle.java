package io.github.flameyossnowy.linkage.api.builder;

/**
 * Typed reference to the result of one member of a {@link Batch}.
 */
public record BatchHandle<R>(int index) {}
