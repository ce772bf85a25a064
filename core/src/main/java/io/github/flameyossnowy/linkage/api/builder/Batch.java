package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.exceptions.BatchException;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs several queries of any kind in one transaction.
 *
 * <pre>{@code
 * Batch batch = client.batch();
 * BatchHandle<ModelWithRelations<User>> user = batch.add(users.create(SetParam.set("email", "a@b.c")));
 * BatchHandle<Long> posts = batch.add(client.entity(Post.class).count());
 * BatchResult result = batch.exec().join();
 * long count = result.get(posts);
 * }</pre>
 * Members run one after another. If any member fails, the transaction is rolled back and the
 * batch fails with that member's exception. A batch executes once.
 */
public final class Batch {
    private final ConnectionLike connection;
    private final List<BatchOperation<?>> operations = new ArrayList<>();
    private boolean executed;

    Batch(@NotNull ConnectionLike connection) {
        this.connection = connection;
    }

    public <R> @NotNull BatchHandle<R> add(@NotNull BatchOperation<R> operation) {
        if (executed) {
            throw new BatchException("Cannot add to a batch that was already executed");
        }
        operations.add(operation);
        return new BatchHandle<>(operations.size() - 1);
    }

    public int size() {
        return operations.size();
    }

    public @NotNull CompletableFuture<BatchResult> exec() {
        if (executed) {
            return CompletableFuture.failedFuture(new BatchException("Batch was already executed"));
        }
        executed = true;
        List<BatchOperation<?>> members = List.copyOf(operations);
        Logging.info(() -> "Executing batch of " + members.size() + " operation(s)");
        return Transactions.scoped(connection, scoped ->
            Futures.sequential(members, operation -> operation.exec(scoped).thenApply(result -> (Object) result))
                .thenApply(BatchResult::new));
    }
}
