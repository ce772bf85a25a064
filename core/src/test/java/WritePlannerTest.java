import io.github.flameyossnowy.linkage.api.exceptions.InvalidFieldTypeException;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.write.DeferredLookup;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import io.github.flameyossnowy.linkage.api.write.WritePlan;
import io.github.flameyossnowy.linkage.api.write.WritePlanner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WritePlannerTest {
    private final WritePlanner planner = new WritePlanner(Blog.registry());

    @Test
    void scalar_sets_go_straight_to_the_active_model() {
        WritePlan<Blog.Post> plan = planner.planCreate(Blog.POSTS, List.of(SetParam.set("title", "Hello"), SetParam.set("views", 0)));

        assertEquals("Hello", plan.active().get("title"));
        assertTrue(plan.lookups().isEmpty());
        assertFalse(plan.needsTransaction());
    }

    @Test
    void connect_by_key_assigns_foreign_key_without_lookup() {
        WritePlan<Blog.Post> plan = planner.planCreate(Blog.POSTS, List.of(SetParam.connect("author", Key.of(3L))));

        assertEquals(3L, plan.active().get("userId"));
        assertTrue(plan.lookups().isEmpty());
    }

    @Test
    void connect_by_unique_field_is_deferred() {
        WritePlan<Blog.Post> plan = planner.planCreate(Blog.POSTS, List.of(SetParam.connect("author", UniqueWhere.of("email", "a@b.c"))));

        assertEquals(List.of(new DeferredLookup.ByCondition("user", UniqueWhere.of("email", "a@b.c"), "userId")), plan.lookups());
        assertFalse(plan.active().isSet("userId"));
        assertTrue(plan.needsTransaction());
    }

    @Test
    void connect_by_non_unique_field_is_rejected() {
        assertThrows(QueryValidationException.class,
            () -> planner.planCreate(Blog.POSTS, List.of(SetParam.connect("author", UniqueWhere.of("name", "Ann")))));
    }

    @Test
    void disconnect_requires_nullable_foreign_key() {
        WritePlan<Blog.Post> plan = planner.planUpdate(Blog.POSTS, List.of(SetParam.disconnect("author")));
        assertTrue(plan.active().isSet("userId"));
        assertNull(plan.active().get("userId"));

        assertThrows(QueryValidationException.class,
            () -> planner.planUpdate(Blog.COMMENTS, List.of(SetParam.disconnect("post"))));
    }

    @Test
    void atomics_are_update_only_and_numeric_only() {
        assertThrows(QueryValidationException.class,
            () -> planner.planCreate(Blog.POSTS, List.of(SetParam.increment("views", 1))));
        assertThrows(InvalidFieldTypeException.class,
            () -> planner.planUpdate(Blog.POSTS, List.of(SetParam.increment("title", 1))));

        WritePlan<Blog.Post> plan = planner.planUpdate(Blog.POSTS, List.of(SetParam.increment("views", 1)));
        assertEquals(1, plan.atomics().size());
    }

    @Test
    void relation_kind_must_match_the_operation() {
        assertThrows(QueryValidationException.class,
            () -> planner.planCreate(Blog.USERS, List.of(SetParam.connect("posts", Key.of(1L)))));
        assertThrows(QueryValidationException.class,
            () -> planner.planCreate(Blog.POSTS, List.of(SetParam.create("author", List.of(List.of())))));
        assertThrows(RelationNotFoundException.class,
            () -> planner.planCreate(Blog.POSTS, List.of(SetParam.disconnect("editor"))));
    }

    @Test
    void nested_creates_and_relation_sets_are_collected() {
        WritePlan<Blog.User> plan = planner.planCreate(Blog.USERS, List.of(
            SetParam.set("email", "a@b.c"),
            SetParam.create("posts", List.of(List.of(SetParam.set("title", "First")))),
            SetParam.setRelation("posts", List.of(UniqueWhere.of("id", 9L)))
        ));

        assertEquals(1, plan.postInsert().size());
        assertEquals(1, plan.relationSets().size());
        assertTrue(plan.needsTransaction());
    }
}
