package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.exceptions.MissingConfigurationException;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * The generated-client surface: one entry point per entity, plus transactions and batches.
 *
 * <pre>{@code
 * LinkageClient client = LinkageClient.builder()
 *     .withRegistry(registry)
 *     .withConnection(SQLiteDatabaseBuilder.create().withCredentials(new SQLiteCredentials("app.db")).build())
 *     .build();
 *
 * client.transaction(tx -> tx.entity(User.class).create(SetParam.set("email", "ada@example.com")).exec());
 * }</pre>
 */
public final class LinkageClient {
    private final QueryContext context;
    private final ConnectionLike connection;

    private LinkageClient(QueryContext context, ConnectionLike connection) {
        this.context = context;
        this.connection = connection;
    }

    public static Builder builder() {
        return new Builder();
    }

    public <T> @NotNull EntityClient<T> entity(@NotNull Class<T> entityClass) {
        return new EntityClient<>(context, context.registry().requireModel(entityClass), connection);
    }

    public @NotNull EntityClient<?> entity(@NotNull String entityName) {
        return entity(context.registry().requireModel(entityName));
    }

    private <T> EntityClient<T> entity(EntityModel<T> model) {
        return new EntityClient<>(context, model, connection);
    }

    public @NotNull ConnectionLike connection() {
        return connection;
    }

    public @NotNull EntityRegistry registry() {
        return context.registry();
    }

    /**
     * Runs {@code work} in one transaction. The client handed to {@code work} runs every query on that
     * transaction; if the returned future fails, everything is rolled back.
     */
    public <R> @NotNull CompletableFuture<R> transaction(@NotNull Function<LinkageClient, CompletableFuture<R>> work) {
        return Transactions.scoped(connection, scoped -> work.apply(new LinkageClient(context, scoped)));
    }

    public @NotNull Batch batch() {
        return new Batch(connection);
    }

    /**
     * Runs queries of the same result type in one transaction, returning their results in order.
     */
    public <R> @NotNull CompletableFuture<List<R>> batch(@NotNull List<? extends BatchOperation<R>> operations) {
        List<BatchOperation<R>> members = List.copyOf(operations);
        return Transactions.scoped(connection, scoped -> Futures.sequential(members, operation -> operation.exec(scoped)));
    }

    public static final class Builder {
        private EntityRegistry registry;
        private ConnectionLike connection;

        private Builder() {}

        public Builder withRegistry(@NotNull EntityRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withConnection(@NotNull ConnectionLike connection) {
            this.connection = connection;
            return this;
        }

        public LinkageClient build() {
            if (registry == null) {
                throw new MissingConfigurationException("LinkageClient needs an entity registry");
            }
            if (connection == null) {
                throw new MissingConfigurationException("LinkageClient needs a connection");
            }
            return new LinkageClient(new QueryContext(registry), connection);
        }
    }
}
