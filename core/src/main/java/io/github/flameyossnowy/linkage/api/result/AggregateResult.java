package io.github.flameyossnowy.linkage.api.result;

import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.FieldNotFetchedException;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.options.AggregateFieldDefinition;
import io.github.flameyossnowy.linkage.api.options.AggregationType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Aggregates computed over a set of rows.
 * <p>
 * {@code sum} and {@code avg} are empty ({@code null}) when no row matched; {@code min} and {@code max}
 * come back in the field's declared type.
 */
public class AggregateResult {
    protected final EntityModel<?> model;
    protected final Row row;

    public AggregateResult(@NotNull EntityModel<?> model, @NotNull Row row) {
        this.model = model;
        this.row = row;
    }

    public long count() {
        Long count = row.getLong(require(AggregateFieldDefinition.count()));
        return count == null ? 0L : count;
    }

    /**
     * Number of rows where {@code field} is not null.
     */
    public long count(@NotNull String field) {
        Long count = row.getLong(require(AggregateFieldDefinition.of(AggregationType.COUNT, field)));
        return count == null ? 0L : count;
    }

    public @Nullable Double sum(@NotNull String field) {
        return row.getDouble(require(AggregateFieldDefinition.of(AggregationType.SUM, field)));
    }

    public @Nullable Double avg(@NotNull String field) {
        return row.getDouble(require(AggregateFieldDefinition.of(AggregationType.AVG, field)));
    }

    public <V> @Nullable V min(@NotNull String field, @NotNull Class<V> type) {
        return typed(AggregateFieldDefinition.of(AggregationType.MIN, field), type);
    }

    public <V> @Nullable V max(@NotNull String field, @NotNull Class<V> type) {
        return typed(AggregateFieldDefinition.of(AggregationType.MAX, field), type);
    }

    /**
     * The raw value of any aggregate in this result.
     */
    public @Nullable Object get(@NotNull AggregateFieldDefinition aggregate) {
        return row.get(require(aggregate));
    }

    public @NotNull Map<String, Object> asMap() {
        return row.asMap();
    }

    private <V> V typed(AggregateFieldDefinition aggregate, Class<V> type) {
        Object raw = row.get(require(aggregate));
        if (raw == null) return null;
        Object value = model.requireField(aggregate.field()).fromDbValue(raw);
        return type.cast(value);
    }

    private String require(AggregateFieldDefinition aggregate) {
        if (!row.contains(aggregate.alias())) {
            throw new FieldNotFetchedException("Aggregate " + aggregate.aggregationType() + "("
                + (aggregate.isCountAll() ? "*" : aggregate.field()) + ") was not requested");
        }
        return aggregate.alias();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + row.asMap();
    }
}
