import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.fetch.EntityFetcher;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.handler.NestedIncludeEngine;
import io.github.flameyossnowy.linkage.api.handler.ProjectionMode;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.result.RelationValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class NestedIncludeEngineTest {
    private final ConnectionLike connection = mock(ConnectionLike.class);
    private final EntityFetcher userFetcher = mock(EntityFetcher.class);
    private final EntityFetcher postFetcher = mock(EntityFetcher.class);
    private NestedIncludeEngine engine;

    @BeforeEach
    void setUp() {
        EntityRegistry registry = EntityRegistry.builder()
            .register(Blog.USERS, ignored -> userFetcher)
            .register(Blog.POSTS, ignored -> postFetcher)
            .register(Blog.COMMENTS)
            .build();
        engine = new NestedIncludeEngine(registry);
    }

    @Test
    void has_many_rows_are_loaded_with_their_own_includes() {
        ModelWithRelations<Blog.User> user = new ModelWithRelations<>(Blog.USERS, user(1L));
        ModelWithRelations<Blog.Post> post = new ModelWithRelations<>(Blog.POSTS, post(10L, 1L));

        when(userFetcher.fetchByForeignKey(any(), eq(Optional.of(Key.of(1L))), anyString(), eq("post"), eq("posts"), any()))
            .thenReturn(CompletableFuture.completedFuture(RelationValue.<ModelWithRelations<?>>many(List.of(post))));
        when(postFetcher.countByForeignKey(any(), eq(Optional.of(Key.of(10L))), eq("comments"), any()))
            .thenReturn(CompletableFuture.completedFuture(3L));

        engine.apply(connection, user, List.of(
            RelationFilter.include("posts").with(RelationFilter.include("comments").count()).build()
        ), ProjectionMode.FULL).join();

        List<ModelWithRelations<Blog.Post>> posts = user.many("posts", Blog.Post.class);
        assertEquals(1, posts.size());
        assertEquals(Optional.of(3L), posts.get(0).counts().get("comments"));
        assertFalse(posts.get(0).isLoaded("comments"));
    }

    @Test
    void belongs_to_without_foreign_key_does_no_io() {
        ModelWithRelations<Blog.Post> post = new ModelWithRelations<>(Blog.POSTS, post(10L, null));

        engine.apply(connection, post, List.of(RelationFilter.include("author").build()), ProjectionMode.FULL).join();

        assertFalse(post.isLoaded("author"));
        verifyNoInteractions(postFetcher);
    }

    @Test
    void duplicate_include_is_traversed_once() {
        ModelWithRelations<Blog.User> user = new ModelWithRelations<>(Blog.USERS, user(1L));
        when(userFetcher.fetchByForeignKey(any(), any(), anyString(), anyString(), eq("posts"), any()))
            .thenReturn(CompletableFuture.completedFuture(RelationValue.<ModelWithRelations<?>>many(List.of())));

        engine.apply(connection, user, List.of(
            RelationFilter.include("posts").build(),
            RelationFilter.include("posts").take(1).build()
        ), ProjectionMode.FULL).join();

        verify(userFetcher, times(1)).fetchByForeignKey(any(), any(), anyString(), anyString(), eq("posts"), any());
        assertTrue(user.many("posts", Blog.Post.class).isEmpty());
    }

    @Test
    void count_alongside_fetch_records_both() {
        ModelWithRelations<Blog.User> user = new ModelWithRelations<>(Blog.USERS, user(1L));
        ModelWithRelations<Blog.Post> post = new ModelWithRelations<>(Blog.POSTS, post(10L, 1L));
        when(userFetcher.fetchByForeignKey(any(), any(), anyString(), anyString(), eq("posts"), any()))
            .thenReturn(CompletableFuture.completedFuture(RelationValue.<ModelWithRelations<?>>many(List.of(post))));
        when(userFetcher.countByForeignKey(any(), any(), eq("posts"), any()))
            .thenReturn(CompletableFuture.completedFuture(7L));
        when(postFetcher.fetchByForeignKey(any(), any(), anyString(), anyString(), eq("author"), any()))
            .thenReturn(CompletableFuture.completedFuture(RelationValue.<ModelWithRelations<?>>one(user)));

        engine.apply(connection, user, List.of(
            RelationFilter.include("posts").count().with(RelationFilter.include("author")).build()
        ), ProjectionMode.FULL).join();

        assertEquals(Optional.of(7L), user.counts().get("posts"));
        ModelWithRelations<Blog.Post> loaded = user.many("posts", Blog.Post.class).get(0);
        assertTrue(loaded.one("author", Blog.User.class).isPresent());
    }

    private static Blog.User user(Long id) {
        Blog.User user = new Blog.User();
        user.setId(id);
        user.setEmail("u" + id + "@example.com");
        user.setName("User " + id);
        return user;
    }

    private static Blog.Post post(Long id, Long userId) {
        Blog.Post post = new Blog.Post();
        post.setId(id);
        post.setTitle("Post " + id);
        post.setViews(0);
        post.setUserId(userId);
        return post;
    }
}
