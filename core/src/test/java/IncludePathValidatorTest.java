import io.github.flameyossnowy.linkage.api.exceptions.InvalidIncludePathException;
import io.github.flameyossnowy.linkage.api.handler.IncludePathValidator;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IncludePathValidatorTest {
    private final IncludePathValidator validator = new IncludePathValidator(Blog.registry());

    @Test
    void valid_nested_path_passes() {
        assertDoesNotThrow(() -> validator.validate(Blog.USERS, List.of(
            RelationFilter.include("posts")
                .select("title")
                .with(RelationFilter.include("comments").count())
                .build()
        )));
    }

    @Test
    void unknown_nested_relation_reports_full_path() {
        InvalidIncludePathException error = assertThrows(InvalidIncludePathException.class, () -> validator.validate(Blog.USERS, List.of(
            RelationFilter.include("posts").with(RelationFilter.include("likes")).build()
        )));
        assertTrue(error.getMessage().contains("posts.likes"), error.getMessage());
    }

    @Test
    void selected_alias_must_exist_on_target() {
        assertThrows(InvalidIncludePathException.class, () -> validator.validate(Blog.POSTS, List.of(
            RelationFilter.include("author").select("password").build()
        )));
    }

    @Test
    void negative_skip_is_rejected() {
        assertThrows(InvalidIncludePathException.class, () -> validator.validate(Blog.USERS, List.of(
            RelationFilter.include("posts").skip(-1).build()
        )));
    }
}
