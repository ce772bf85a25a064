package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import io.github.flameyossnowy.linkage.api.write.WritePlan;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Inserts one row and returns it as stored, with the requested relations loaded.
 * <p>
 * Connects through non-key unique fields are resolved right before the insert, and nested creates run
 * right after it. When either is present and the builder runs on a plain connection, everything runs in
 * one transaction.
 */
public final class CreateQueryBuilder<T> extends AbstractQueryBuilder<T, ModelWithRelations<T>> {
    private final List<SetParam> params;
    private final List<RelationFilter> includes = new ArrayList<>();

    CreateQueryBuilder(@NotNull EntityClient<T> client, @NotNull List<SetParam> params) {
        super(client);
        this.params = List.copyOf(params);
    }

    public CreateQueryBuilder<T> with(RelationFilter... includes) {
        this.includes.addAll(Arrays.asList(includes));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<ModelWithRelations<T>> run(@NotNull ConnectionLike connection) {
        WritePlan<T> plan = context().writer().planner().planCreate(model(), params);
        context().includeValidator().validate(model(), includes);
        if (plan.needsTransaction()) {
            return Transactions.scoped(connection, scoped -> create(scoped, plan));
        }
        return create(connection, plan);
    }

    private CompletableFuture<ModelWithRelations<T>> create(ConnectionLike connection, WritePlan<T> plan) {
        return context().writer().insert(connection, plan, null)
            .thenCompose(key -> selectOne(connection, List.of(keyFilter(key)))
                .thenApply(found -> found.orElseThrow(() -> new RecordNotFoundException("Created " + model().entityName() + ' ' + key + " could not be read back"))))
            .thenCompose(node -> {
                Logging.info(() -> "Created " + model().entityName() + ' ' + model().primaryKeyOf(node.entity()));
                return loadIncludes(connection, node, includes);
            });
    }
}
