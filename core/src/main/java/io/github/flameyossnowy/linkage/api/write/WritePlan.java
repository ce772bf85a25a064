package io.github.flameyossnowy.linkage.api.write;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A create or update turned into the steps that run against storage.
 *
 * @param active       scalar and immediately assigned foreign key values
 * @param lookups      foreign keys resolved right before the row is written, in order
 * @param postInsert   nested has-many creates that need the owning row's key
 * @param relationSets has-many memberships replaced through the owning row's key
 * @param atomics      read-modify-write arithmetic, applied against the current row
 */
public record WritePlan<T>(
    @NotNull ActiveModel<T> active,
    @NotNull List<DeferredLookup> lookups,
    @NotNull List<PostInsertOperation> postInsert,
    @NotNull List<HasManySetOperation> relationSets,
    @NotNull List<SetParam.Atomic> atomics
) {
    public WritePlan {
        lookups = List.copyOf(lookups);
        postInsert = List.copyOf(postInsert);
        relationSets = List.copyOf(relationSets);
        atomics = List.copyOf(atomics);
    }

    /**
     * Whether running this plan takes more than one statement whose effects must land together.
     */
    public boolean needsTransaction() {
        return !lookups.isEmpty() || !postInsert.isEmpty() || !relationSets.isEmpty();
    }
}
