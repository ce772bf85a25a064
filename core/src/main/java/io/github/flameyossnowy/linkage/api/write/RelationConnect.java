package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import org.jetbrains.annotations.NotNull;

/**
 * Identifies the row a belongs-to relation should point at.
 */
public sealed interface RelationConnect permits RelationConnect.ById, RelationConnect.ByUnique {

    record ById(@NotNull Key key) implements RelationConnect {}

    /**
     * A unique condition. When it names the target's primary key it is used directly, otherwise it is
     * resolved by a lookup right before the write.
     */
    record ByUnique(@NotNull UniqueWhere condition) implements RelationConnect {}
}
