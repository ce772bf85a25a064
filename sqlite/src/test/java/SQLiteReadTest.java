import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.flameyossnowy.linkage.api.builder.EntityClient;
import io.github.flameyossnowy.linkage.api.exceptions.FieldNotFetchedException;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.ValueConverter;
import io.github.flameyossnowy.linkage.api.options.AggregateFieldDefinition;
import io.github.flameyossnowy.linkage.api.options.FieldOp;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.OrderBy;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.SortOrder;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.result.AggregateResult;
import io.github.flameyossnowy.linkage.api.result.GroupByRow;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.result.Selected;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static io.github.flameyossnowy.linkage.api.write.SetParam.create;
import static io.github.flameyossnowy.linkage.api.write.SetParam.set;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Ada has posts viewed 5, 20 and 1 times, the 20-view post has two comments.
 * Bob has one post viewed 2 times. Cy has no posts.
 */
class SQLiteReadTest {
    @TempDir
    Path directory;

    private SQLiteTestDatabase database;
    private EntityClient<Blog.User> users;
    private EntityClient<Blog.Post> posts;
    private long adaId;

    @BeforeEach
    void setUp() throws Exception {
        database = SQLiteTestDatabase.create(directory);
        users = database.client.entity(Blog.User.class);
        posts = database.client.entity(Blog.Post.class);

        adaId = users.create(
            set("email", "ada@example.com"),
            set("name", "Ada"),
            set("age", 36),
            set("profile", ValueConverter.MAPPER.readTree("{\"tier\":\"gold\",\"tags\":[\"math\",\"engines\"]}")),
            create("posts", List.of(
                List.of(set("title", "Notes"), set("views", 5)),
                List.of(set("title", "Engines"), set("views", 20)),
                List.of(set("title", "Drafts"), set("views", 1))
            ))
        ).exec().join().entity().getId();

        users.create(
            set("email", "bob@example.com"),
            set("name", "Bob"),
            set("profile", ValueConverter.MAPPER.readTree("{\"tier\":\"silver\",\"tags\":[]}")),
            create("posts", List.of(List.of(set("title", "Hello"), set("views", 2))))
        ).exec().join();

        users.create(set("email", "cy@example.com"), set("name", "Cy")).exec().join();

        Blog.Post engines = posts.findFirst().where(Filter.equals("title", "Engines")).exec().join().orElseThrow().entity();
        database.client.entity(Blog.Comment.class).createMany(List.of(
            List.of(set("body", "Great"), set("postId", engines.getId())),
            List.of(set("body", "Agreed"), set("postId", engines.getId()))
        )).exec().join();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void include_take_applies_per_parent() {
        List<ModelWithRelations<Blog.User>> result = users.findMany()
            .orderBy(OrderBy.asc("id"))
            .with(RelationFilter.include("posts").orderBy("views", SortOrder.DESC).take(1).build())
            .exec().join();

        assertEquals(3, result.size());
        assertEquals(List.of("Engines"), titles(result.get(0)));
        assertEquals(List.of("Hello"), titles(result.get(1)));
        assertTrue(result.get(2).many("posts", Blog.Post.class).isEmpty());
    }

    @Test
    void include_skip_and_filter_on_related_rows() {
        ModelWithRelations<Blog.User> ada = users.findUnique(UniqueWhere.of("id", adaId))
            .with(RelationFilter.include("posts").where(Filter.gt("views", 1)).orderBy("views", SortOrder.ASC).skip(1).build())
            .exec().join().orElseThrow();

        assertEquals(List.of("Engines"), titles(ada));
    }

    @Test
    void nested_includes_and_counts() {
        ModelWithRelations<Blog.User> ada = users.findUnique(UniqueWhere.of("email", "ada@example.com"))
            .with(RelationFilter.include("posts")
                .orderBy("views", SortOrder.DESC)
                .count()
                .with(RelationFilter.include("comments").orderBy("id", SortOrder.ASC).build())
                .build())
            .exec().join().orElseThrow();

        assertEquals(3L, ada.counts().get("posts").orElseThrow());
        ModelWithRelations<Blog.Post> top = ada.many("posts", Blog.Post.class).get(0);
        assertEquals(List.of("Great", "Agreed"),
            top.many("comments", Blog.Comment.class).stream().map(comment -> comment.entity().getBody()).toList());
    }

    @Test
    void count_only_include_does_not_load_rows() {
        List<ModelWithRelations<Blog.User>> result = users.findMany()
            .orderBy(OrderBy.asc("id"))
            .with(RelationFilter.include("posts").count().build())
            .exec().join();

        assertEquals(List.of(3L, 1L, 0L), result.stream().map(user -> user.counts().get("posts").orElseThrow()).toList());
        assertFalse(result.get(0).isLoaded("posts"));
    }

    @Test
    void take_one_skip_one_yields_second_child() {
        ModelWithRelations<Blog.User> ada = users.findUnique(UniqueWhere.of("id", adaId))
            .with(RelationFilter.include("posts").orderBy("id", SortOrder.ASC).take(1).skip(1).build())
            .exec().join().orElseThrow();

        assertEquals(List.of("Engines"), titles(ada));
    }

    @Test
    void include_count_ignores_pagination_and_matches_count_query() {
        ModelWithRelations<Blog.User> ada = users.findUnique(UniqueWhere.of("id", adaId))
            .with(RelationFilter.include("posts").where(Filter.gt("views", 1)).take(1).count()
                .with(RelationFilter.include("comments").build())
                .build())
            .exec().join().orElseThrow();

        long standalone = posts.count().where(Filter.equals("userId", adaId), Filter.gt("views", 1)).exec().join();
        assertEquals(2L, standalone);
        assertEquals(standalone, ada.counts().get("posts").orElseThrow());
        assertEquals(1, ada.many("posts", Blog.Post.class).size());
    }

    @Test
    void belongs_to_include_loads_author() {
        ModelWithRelations<Blog.Post> hello = posts.findFirst()
            .where(Filter.equals("title", "Hello"))
            .with(RelationFilter.include("author").build())
            .exec().join().orElseThrow();

        assertEquals("Bob", hello.one("author", Blog.User.class).orElseThrow().entity().getName());
    }

    @Test
    void relation_quantifiers_filter_parents() {
        assertEquals(List.of("Ada"), names(users.findMany().where(WhereParam.some("posts", Filter.gt("views", 10))).exec().join()));
        assertEquals(List.of("Cy"), names(users.findMany().where(WhereParam.none("posts")).exec().join()));
        assertEquals(List.of("Bob", "Cy"),
            names(users.findMany().where(WhereParam.every("posts", Filter.lt("views", 10))).orderBy(OrderBy.asc("name")).exec().join()));
    }

    @Test
    void order_by_relation_count() {
        List<ModelWithRelations<Blog.User>> result = users.findMany()
            .orderBy(OrderBy.relationCount("posts", SortOrder.DESC))
            .exec().join();

        assertEquals(List.of("Ada", "Bob", "Cy"), names(result));
    }

    @Test
    void contains_is_case_sensitive_unless_insensitive() {
        assertTrue(users.findMany().where(Filter.contains("name", "ada")).exec().join().isEmpty());
        assertEquals(List.of("Ada"), names(users.findMany().where(Filter.contains("name", "ada").insensitive()).exec().join()));
    }

    @Test
    void negative_take_returns_last_rows_in_order() {
        List<ModelWithRelations<Blog.Post>> result = posts.findMany().orderBy(OrderBy.asc("views")).take(-2).exec().join();

        assertEquals(List.of(5, 20), result.stream().map(post -> post.entity().getViews()).toList());
    }

    @Test
    void cursor_starts_after_the_given_row() {
        List<ModelWithRelations<Blog.Post>> all = posts.findMany().orderBy(OrderBy.asc("id")).exec().join();
        long first = all.get(0).entity().getId();

        List<ModelWithRelations<Blog.Post>> page = posts.findMany().cursor(Key.of(first)).take(2).exec().join();

        assertEquals(List.of(all.get(1).entity().getId(), all.get(2).entity().getId()),
            page.stream().map(post -> post.entity().getId()).toList());
    }

    @Test
    void selection_only_fetches_requested_fields() {
        List<Selected<Blog.User>> result = users.findMany()
            .where(Filter.equals("email", "bob@example.com"))
            .select("name")
            .with(RelationFilter.include("posts").select("title").build())
            .exec().join();

        Selected<Blog.User> bob = result.get(0);
        assertEquals("Bob", bob.get("name", String.class));
        assertThrows(FieldNotFetchedException.class, () -> bob.get("email", String.class));
        Selected<Blog.Post> post = bob.many("posts", Blog.Post.class).get(0);
        assertEquals("Hello", post.get("title", String.class));
        assertFalse(post.isFetched("views"));
    }

    @Test
    void distinct_on_field_keeps_one_row_per_value() {
        posts.create(set("title", "Notes"), set("views", 7)).exec().join();

        List<ModelWithRelations<Blog.Post>> result = posts.findMany().distinct("title").orderBy(OrderBy.asc("title")).exec().join();

        assertEquals(List.of("Drafts", "Engines", "Hello", "Notes"), result.stream().map(post -> post.entity().getTitle()).toList());
    }

    @Test
    void aggregate_over_filtered_rows() {
        AggregateResult result = posts.aggregate()
            .count()
            .sum("views")
            .avg("views")
            .max("views")
            .where(Filter.equals("userId", adaId))
            .exec().join();

        assertEquals(3L, result.count());
        assertEquals(26.0, result.sum("views"));
        assertEquals(26.0 / 3, result.avg("views"), 1e-9);
        assertEquals(20, result.max("views", Integer.class));
    }

    @Test
    void group_by_with_having() {
        List<GroupByRow> rows = posts.groupBy("userId")
            .count()
            .sum("views")
            .having(AggregateFieldDefinition.count(), new FieldOp.Gte(1))
            .orderBy(OrderBy.aggregate(AggregateFieldDefinition.count(), SortOrder.DESC))
            .exec().join();

        assertEquals(2, rows.size());
        assertEquals(adaId, rows.get(0).field("userId", Long.class));
        assertEquals(3L, rows.get(0).count());
        assertEquals(2.0, rows.get(1).sum("views"));
    }

    @Test
    void json_path_and_array_filters() {
        assertEquals(List.of("Ada"),
            names(users.findMany().where(Filter.json("profile", List.of("tier"), new FieldOp.Equals("gold"))).exec().join()));

        Filter tagged = new Filter("profile", new FieldOp.JsonPath(List.of("tags"),
            new FieldOp.JsonArrayContains(JsonNodeFactory.instance.textNode("engines"))));
        assertEquals(List.of("Ada"), names(users.findMany().where(tagged).exec().join()));

        assertEquals(List.of("Ada", "Bob"),
            names(users.findMany().where(Filter.jsonObjectContains("profile", "tier")).orderBy(OrderBy.asc("name")).exec().join()));
    }

    @Test
    void json_values_round_trip_as_nodes() {
        Blog.User ada = users.findUnique(UniqueWhere.of("id", adaId)).exec().join().orElseThrow().entity();

        assertEquals("gold", ada.getProfile().get("tier").asText());
        assertEquals(2, ada.getProfile().get("tags").size());
    }

    private static List<String> titles(ModelWithRelations<Blog.User> user) {
        return user.many("posts", Blog.Post.class).stream().map(post -> post.entity().getTitle()).toList();
    }

    private static List<String> names(List<ModelWithRelations<Blog.User>> users) {
        return users.stream().map(user -> user.entity().getName()).toList();
    }
}
