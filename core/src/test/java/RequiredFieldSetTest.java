import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.linkage.api.options.ColumnSelection;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.selection.ProjectionPlanner;
import io.github.flameyossnowy.linkage.api.selection.RequiredFieldSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RequiredFieldSetTest {

    @Test
    void selection_always_includes_primary_key() {
        Set<String> required = RequiredFieldSet.compute(Blog.POSTS, List.of("title"), List.of());
        assertEquals(Set.of("title", "id"), required);
    }

    @Test
    void belongs_to_include_pulls_in_foreign_key() {
        Set<String> required = RequiredFieldSet.compute(Blog.POSTS, List.of("title"),
            List.of(RelationFilter.include("author").build()));
        assertTrue(required.contains("userId"));
    }

    @Test
    void has_many_include_needs_only_primary_key() {
        Set<String> required = RequiredFieldSet.compute(Blog.USERS, List.of("name"),
            List.of(RelationFilter.include("posts").build()));
        assertEquals(Set.of("name", "id"), required);
    }

    @Test
    void no_selection_means_every_field() {
        Set<String> required = RequiredFieldSet.compute(Blog.USERS, null, List.of());
        assertEquals(Set.of("id", "email", "name", "age", "profile"), required);
    }

    @Test
    void unknown_alias_or_relation_is_rejected() {
        assertThrows(QueryValidationException.class,
            () -> RequiredFieldSet.compute(Blog.USERS, List.of("nickname"), List.of()));
        assertThrows(RelationNotFoundException.class,
            () -> RequiredFieldSet.compute(Blog.USERS, List.of("name"), List.of(RelationFilter.include("friends").build())));
    }

    @Test
    void projection_aliases_columns_with_field_names() {
        List<ColumnSelection> columns = ProjectionPlanner.plan(Blog.POSTS, RequiredFieldSet.compute(Blog.POSTS, List.of("userId"), List.of()));
        assertTrue(columns.contains(new ColumnSelection("user_id", "userId")));
        assertTrue(columns.contains(new ColumnSelection("id", "id")));
        assertEquals(2, columns.size());
    }
}
