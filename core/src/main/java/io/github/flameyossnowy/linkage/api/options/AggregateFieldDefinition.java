package io.github.flameyossnowy.linkage.api.options;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * An aggregate expression with its result alias.
 *
 * <pre>{@code
 * AggregateFieldDefinition.of(AggregationType.AVG, "age")   // AVG(age) AS _avg_age
 * AggregateFieldDefinition.count()                          // COUNT(*) AS _count
 * }</pre>
 *
 * @param field logical field name, or {@code null} for {@code COUNT(*)}
 */
public record AggregateFieldDefinition(
    @NotNull AggregationType aggregationType,
    @Nullable String field,
    @NotNull String alias
) {
    public static AggregateFieldDefinition count() {
        return new AggregateFieldDefinition(AggregationType.COUNT, null, "_count");
    }

    public static AggregateFieldDefinition of(AggregationType type, String field) {
        return new AggregateFieldDefinition(type, field, "_" + type.name().toLowerCase(Locale.ROOT) + "_" + field);
    }

    public boolean isCountAll() {
        return field == null;
    }
}
