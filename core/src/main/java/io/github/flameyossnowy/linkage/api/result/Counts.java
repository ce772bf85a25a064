package io.github.flameyossnowy.linkage.api.result;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Related row counts requested through {@code RelationFilter.count()}, keyed by relation name.
 */
public final class Counts {
    private final Map<String, Long> counts = new LinkedHashMap<>();

    public void put(@NotNull String relation, long count) {
        counts.put(relation, count);
    }

    public @NotNull Optional<Long> get(@NotNull String relation) {
        return Optional.ofNullable(counts.get(relation));
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public @NotNull Map<String, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        return "Counts" + counts;
    }
}
