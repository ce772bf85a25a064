package io.github.flameyossnowy.linkage.api.selection;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.options.ColumnSelection;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a required field set into {@code column AS alias} expressions, in the model's field order.
 * An empty result means the caller should fall back to a full-row fetch.
 */
public final class ProjectionPlanner {
    private ProjectionPlanner() {}

    public static <T> @NotNull List<ColumnSelection> plan(@NotNull EntityModel<T> model, @NotNull Set<String> requiredFields) {
        List<ColumnSelection> columns = new ArrayList<>(requiredFields.size());
        for (FieldModel<T> field : model.fields()) {
            if (requiredFields.contains(field.name())) {
                columns.add(new ColumnSelection(field.columnName(), field.name()));
            }
        }
        return columns;
    }
}
