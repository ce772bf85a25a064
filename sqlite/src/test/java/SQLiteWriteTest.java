import io.github.flameyossnowy.linkage.api.builder.Batch;
import io.github.flameyossnowy.linkage.api.builder.BatchHandle;
import io.github.flameyossnowy.linkage.api.builder.BatchResult;
import io.github.flameyossnowy.linkage.api.builder.EntityClient;
import io.github.flameyossnowy.linkage.api.exceptions.NotFoundForConditionException;
import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.SortOrder;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static io.github.flameyossnowy.linkage.api.write.SetParam.set;
import static org.junit.jupiter.api.Assertions.*;

class SQLiteWriteTest {
    @TempDir
    Path directory;

    private SQLiteTestDatabase database;
    private EntityClient<Blog.User> users;
    private EntityClient<Blog.Post> posts;

    @BeforeEach
    void setUp() throws SQLException {
        database = SQLiteTestDatabase.create(directory);
        users = database.client.entity(Blog.User.class);
        posts = database.client.entity(Blog.Post.class);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void create_assigns_generated_key() {
        ModelWithRelations<Blog.User> ada = user("ada@example.com", "Ada");

        assertNotNull(ada.entity().getId());
        assertEquals("Ada", ada.entity().getName());
        assertNull(ada.entity().getAge());
    }

    @Test
    void nested_create_points_children_at_new_parent() {
        ModelWithRelations<Blog.User> ada = users.create(
            set("email", "ada@example.com"),
            set("name", "Ada"),
            SetParam.create("posts", List.of(
                List.of(set("title", "First"), set("views", 3)),
                List.of(set("title", "Second"), set("views", 1))
            ))
        ).with(RelationFilter.include("posts").orderBy("views", SortOrder.ASC).build()).exec().join();

        List<ModelWithRelations<Blog.Post>> written = ada.many("posts", Blog.Post.class);
        assertEquals(List.of("Second", "First"), written.stream().map(post -> post.entity().getTitle()).toList());
        for (ModelWithRelations<Blog.Post> post : written) {
            assertEquals(ada.entity().getId(), post.entity().getUserId());
        }
    }

    @Test
    void connect_by_unique_field_resolves_foreign_key() {
        ModelWithRelations<Blog.User> ada = user("ada@example.com", "Ada");

        ModelWithRelations<Blog.Post> post = posts.create(
            set("title", "Hello"),
            set("views", 0),
            SetParam.connect("author", UniqueWhere.of("email", "ada@example.com"))
        ).with(RelationFilter.include("author").build()).exec().join();

        assertEquals(ada.entity().getId(), post.entity().getUserId());
        assertEquals("Ada", post.one("author", Blog.User.class).orElseThrow().entity().getName());
    }

    @Test
    void connect_to_missing_row_fails_without_insert() {
        CompletionException error = assertThrows(CompletionException.class, () -> posts.create(
            set("title", "Orphan"),
            set("views", 0),
            SetParam.connect("author", UniqueWhere.of("email", "nobody@example.com"))
        ).exec().join());

        assertInstanceOf(NotFoundForConditionException.class, Futures.unwrap(error));
        assertEquals(0L, posts.count().exec().join());
    }

    @Test
    void atomic_update_reads_current_value() {
        ModelWithRelations<Blog.Post> post = post(null, "Counter", 10);

        ModelWithRelations<Blog.Post> updated = posts.update(UniqueWhere.of("id", post.entity().getId()),
            SetParam.increment("views", 5)).exec().join();
        assertEquals(15, updated.entity().getViews());

        updated = posts.update(UniqueWhere.of("id", post.entity().getId()), SetParam.multiply("views", 2)).exec().join();
        assertEquals(30, updated.entity().getViews());
    }

    @Test
    void atomic_update_past_field_range_fails_and_keeps_row() {
        ModelWithRelations<Blog.Post> post = post(null, "Counter", Integer.MAX_VALUE);

        CompletionException error = assertThrows(CompletionException.class, () -> posts.update(
            UniqueWhere.of("id", post.entity().getId()), SetParam.increment("views", 1)).exec().join());

        assertInstanceOf(TypeConversionException.class, Futures.unwrap(error));
        Blog.Post stored = posts.findUnique(UniqueWhere.of("id", post.entity().getId())).exec().join().orElseThrow().entity();
        assertEquals(Integer.MAX_VALUE, stored.getViews());
    }

    @Test
    void out_of_range_value_is_not_written() {
        CompletionException error = assertThrows(CompletionException.class,
            () -> posts.create(set("title", "Huge"), set("views", 3_000_000_000L)).exec().join());

        assertInstanceOf(TypeConversionException.class, Futures.unwrap(error));
        assertEquals(0L, posts.count().exec().join());
    }

    @Test
    void disconnect_clears_nullable_foreign_key() {
        ModelWithRelations<Blog.User> ada = user("ada@example.com", "Ada");
        ModelWithRelations<Blog.Post> post = post(ada.entity().getId(), "Hello", 0);

        ModelWithRelations<Blog.Post> updated = posts.update(UniqueWhere.of("id", post.entity().getId()),
            SetParam.disconnect("author")).exec().join();

        assertNull(updated.entity().getUserId());
    }

    @Test
    void set_relation_replaces_has_many_members() {
        ModelWithRelations<Blog.User> ada = user("ada@example.com", "Ada");
        ModelWithRelations<Blog.Post> kept = post(ada.entity().getId(), "Kept", 0);
        ModelWithRelations<Blog.Post> dropped = post(ada.entity().getId(), "Dropped", 0);
        ModelWithRelations<Blog.Post> adopted = post(null, "Adopted", 0);

        ModelWithRelations<Blog.User> updated = users.update(UniqueWhere.of("id", ada.entity().getId()),
            SetParam.setRelation("posts", List.of(
                UniqueWhere.of("id", kept.entity().getId()),
                UniqueWhere.of("id", adopted.entity().getId())
            ))
        ).with(RelationFilter.include("posts").orderBy("id", SortOrder.ASC).build()).exec().join();

        assertEquals(List.of("Kept", "Adopted"),
            updated.many("posts", Blog.Post.class).stream().map(post -> post.entity().getTitle()).toList());
        Blog.Post orphan = posts.findUnique(UniqueWhere.of("id", dropped.entity().getId())).exec().join().orElseThrow().entity();
        assertNull(orphan.getUserId());
    }

    @Test
    void upsert_updates_existing_row() {
        user("ada@example.com", "Ada");

        ModelWithRelations<Blog.User> result = users.upsert(UniqueWhere.of("email", "ada@example.com"),
            List.of(set("email", "ada@example.com"), set("name", "New")),
            List.of(set("name", "Ada Lovelace"))).exec().join();

        assertEquals("Ada Lovelace", result.entity().getName());
        assertEquals(1L, users.count().exec().join());
    }

    @Test
    void update_many_and_delete_many_report_counts() {
        post(null, "a", 1);
        post(null, "b", 2);
        post(null, "c", 30);

        assertEquals(2L, posts.updateMany(set("title", "low")).where(Filter.lt("views", 10)).exec().join());
        assertEquals(2L, posts.count().where(Filter.equals("title", "low")).exec().join());

        assertEquals(2L, posts.deleteMany().where(Filter.equals("title", "low")).exec().join());
        assertEquals(1L, posts.count().exec().join());
    }

    @Test
    void delete_returns_removed_row() {
        ModelWithRelations<Blog.Post> post = post(null, "Gone", 4);

        ModelWithRelations<Blog.Post> deleted = posts.delete(UniqueWhere.of("id", post.entity().getId())).exec().join();

        assertEquals("Gone", deleted.entity().getTitle());
        assertTrue(posts.findUnique(UniqueWhere.of("id", post.entity().getId())).exec().join().isEmpty());
    }

    @Test
    void failed_transaction_is_rolled_back() {
        CompletableFuture<Void> result = database.client.transaction(tx -> tx.entity(Blog.User.class)
            .create(set("email", "ada@example.com"), set("name", "Ada"))
            .exec()
            .thenCompose(created -> CompletableFuture.<Void>failedFuture(new IllegalStateException("abort"))));

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalStateException.class, Futures.unwrap(error));
        assertEquals(0L, users.count().exec().join());
    }

    @Test
    void batch_is_all_or_nothing() {
        CompletableFuture<List<Long>> result = database.client.batch(List.of(
            users.createMany(List.of(List.of(set("email", "ada@example.com"), set("name", "Ada")))),
            users.createMany(List.of(List.of(set("email", "ada@example.com"), set("name", "Duplicate"))))
        ));

        assertThrows(CompletionException.class, result::join);
        assertEquals(0L, users.count().exec().join());
    }

    @Test
    void mixed_batch_rolls_back_every_member() {
        Batch batch = database.client.batch();
        batch.add(users.create(set("email", "ada@example.com"), set("name", "Ada")));
        batch.add(users.count());
        batch.add(users.create(set("email", "ada@example.com"), set("name", "Duplicate")));

        assertThrows(CompletionException.class, () -> batch.exec().join());
        assertEquals(0L, users.count().exec().join());
    }

    @Test
    void mixed_batch_returns_typed_results() {
        Batch batch = database.client.batch();
        BatchHandle<ModelWithRelations<Blog.User>> created = batch.add(users.create(set("email", "ada@example.com"), set("name", "Ada")));
        BatchHandle<Long> counted = batch.add(users.count());

        BatchResult result = batch.exec().join();

        assertEquals("Ada", result.get(created).entity().getName());
        assertEquals(1L, result.get(counted));
    }

    @Test
    void batch_results_follow_submission_order() {
        List<Long> result = database.client.batch(List.of(
            users.createMany(List.of(
                List.of(set("email", "a@example.com"), set("name", "A")),
                List.of(set("email", "b@example.com"), set("name", "B"))
            )),
            users.count()
        )).join();

        assertEquals(List.of(2L, 2L), result);
    }

    private ModelWithRelations<Blog.User> user(String email, String name) {
        return users.create(set("email", email), set("name", name)).exec().join();
    }

    private ModelWithRelations<Blog.Post> post(Long userId, String title, int views) {
        if (userId == null) {
            return posts.create(set("title", title), set("views", views)).exec().join();
        }
        return posts.create(set("title", title), set("views", views), SetParam.connect("author", Key.of(userId.longValue()))).exec().join();
    }
}
