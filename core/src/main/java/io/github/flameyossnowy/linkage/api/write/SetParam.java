package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One change carried by a create or update.
 *
 * <pre>{@code
 * users.create(
 *     SetParam.set("email", "ada@example.com"),
 *     SetParam.set("name", "Ada"),
 *     SetParam.create("posts", List.of(List.of(SetParam.set("title", "Hello"))))
 * );
 * posts.create(SetParam.set("title", "Hi"), SetParam.connect("author", UniqueWhere.of("email", "ada@example.com")));
 * }</pre>
 */
public sealed interface SetParam {

    /** Assigns a scalar field. */
    record Set(@NotNull String field, @Nullable Object value) implements SetParam {}

    /** Read-modify-write arithmetic on a numeric field. Only valid in single-row updates. */
    record Atomic(@NotNull String field, @NotNull AtomicOperation operation, @NotNull Number operand) implements SetParam {}

    /** Points a belongs-to relation at an existing row. */
    record Connect(@NotNull String relation, @NotNull RelationConnect target) implements SetParam {}

    /** Clears a nullable belongs-to relation. */
    record Disconnect(@NotNull String relation) implements SetParam {}

    /** Creates related has-many rows after the owning row is written. */
    record CreateNested(@NotNull String relation, @NotNull List<List<SetParam>> rows) implements SetParam {
        public CreateNested {
            rows = rows.stream().map(List::copyOf).toList();
        }
    }

    /** Makes exactly the given rows the members of a has-many relation. */
    record SetRelation(@NotNull String relation, @NotNull List<UniqueWhere> targets) implements SetParam {
        public SetRelation {
            targets = List.copyOf(targets);
        }
    }

    enum AtomicOperation {
        INCREMENT,
        DECREMENT,
        MULTIPLY,
        DIVIDE
    }

    static SetParam set(String field, @Nullable Object value) {
        return new Set(field, value);
    }

    static SetParam increment(String field, Number by) {
        return new Atomic(field, AtomicOperation.INCREMENT, by);
    }

    static SetParam decrement(String field, Number by) {
        return new Atomic(field, AtomicOperation.DECREMENT, by);
    }

    static SetParam multiply(String field, Number by) {
        return new Atomic(field, AtomicOperation.MULTIPLY, by);
    }

    static SetParam divide(String field, Number by) {
        return new Atomic(field, AtomicOperation.DIVIDE, by);
    }

    static SetParam connect(String relation, UniqueWhere target) {
        return new Connect(relation, new RelationConnect.ByUnique(target));
    }

    static SetParam connect(String relation, Key target) {
        return new Connect(relation, new RelationConnect.ById(target));
    }

    static SetParam disconnect(String relation) {
        return new Disconnect(relation);
    }

    static SetParam create(String relation, List<List<SetParam>> rows) {
        return new CreateNested(relation, rows);
    }

    static SetParam setRelation(String relation, List<UniqueWhere> targets) {
        return new SetRelation(relation, targets);
    }
}
