package io.github.flameyossnowy.linkage.api.result;

import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.FieldNotFetchedException;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One group of a group-by query: the group field values plus the aggregates computed for the group.
 */
public final class GroupByRow extends AggregateResult {
    private final List<String> groupFields;

    public GroupByRow(@NotNull EntityModel<?> model, @NotNull Row row, @NotNull List<String> groupFields) {
        super(model, row);
        this.groupFields = List.copyOf(groupFields);
    }

    /**
     * The value of a group field, in the field's declared type.
     */
    public <V> @Nullable V field(@NotNull String field, @NotNull Class<V> type) {
        if (!groupFields.contains(field)) {
            throw new FieldNotFetchedException("Field '" + field + "' is not a group field");
        }
        Object value = model.requireField(field).fromDbValue(row.get(field));
        return value == null ? null : type.cast(value);
    }

    public @NotNull List<String> groupFields() {
        return groupFields;
    }
}
