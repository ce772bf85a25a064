import com.fasterxml.jackson.databind.JsonNode;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;

/**
 * User -> posts -> comments, with a nullable post author and a required comment post.
 */
final class Blog {
    static final EntityModel<User> USERS = EntityModel.builder("user", "users", User.class, User::new)
        .field(FieldModel.<User>builder("id", Long.class).id().autoIncrement().accessors(User::getId, User::setId).build())
        .field(FieldModel.<User>builder("email", String.class).unique().accessors(User::getEmail, User::setEmail).build())
        .field(FieldModel.<User>builder("name", String.class).accessors(User::getName, User::setName).build())
        .field(FieldModel.<User>builder("age", Integer.class).nullable().accessors(User::getAge, User::setAge).build())
        .field(FieldModel.<User>builder("profile", JsonNode.class).nullable().json().accessors(User::getProfile, User::setProfile).build())
        .relation(RelationDescriptor.<User>hasMany("posts", "post").foreignKey("userId", "user_id").targetTable("posts", "id").nullable().build())
        .build();

    static final EntityModel<Post> POSTS = EntityModel.builder("post", "posts", Post.class, Post::new)
        .field(FieldModel.<Post>builder("id", Long.class).id().autoIncrement().accessors(Post::getId, Post::setId).build())
        .field(FieldModel.<Post>builder("title", String.class).accessors(Post::getTitle, Post::setTitle).build())
        .field(FieldModel.<Post>builder("views", Integer.class).accessors(Post::getViews, Post::setViews).build())
        .field(FieldModel.<Post>builder("userId", Long.class).column("user_id").nullable().accessors(Post::getUserId, Post::setUserId).build())
        .relation(RelationDescriptor.<Post>belongsTo("author", "user").foreignKey("userId", "user_id").targetTable("users", "id").nullable().build())
        .relation(RelationDescriptor.<Post>hasMany("comments", "comment").foreignKey("postId", "post_id").targetTable("comments", "id").build())
        .build();

    static final EntityModel<Comment> COMMENTS = EntityModel.builder("comment", "comments", Comment.class, Comment::new)
        .field(FieldModel.<Comment>builder("id", Long.class).id().autoIncrement().accessors(Comment::getId, Comment::setId).build())
        .field(FieldModel.<Comment>builder("body", String.class).accessors(Comment::getBody, Comment::setBody).build())
        .field(FieldModel.<Comment>builder("postId", Long.class).column("post_id").accessors(Comment::getPostId, Comment::setPostId).build())
        .relation(RelationDescriptor.<Comment>belongsTo("post", "post").foreignKey("postId", "post_id").targetTable("posts", "id").build())
        .build();

    private Blog() {}

    static EntityRegistry registry() {
        return EntityRegistry.builder()
            .register(USERS)
            .register(POSTS)
            .register(COMMENTS)
            .build();
    }

    static final class User {
        private Long id;
        private String email;
        private String name;
        private Integer age;
        private JsonNode profile;

        public Long getId() {
            return id;
        }

        public void setId(Long id) {
            this.id = id;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Integer getAge() {
            return age;
        }

        public void setAge(Integer age) {
            this.age = age;
        }

        public JsonNode getProfile() {
            return profile;
        }

        public void setProfile(JsonNode profile) {
            this.profile = profile;
        }
    }

    static final class Post {
        private Long id;
        private String title;
        private Integer views;
        private Long userId;

        public Long getId() {
            return id;
        }

        public void setId(Long id) {
            this.id = id;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public Integer getViews() {
            return views;
        }

        public void setViews(Integer views) {
            this.views = views;
        }

        public Long getUserId() {
            return userId;
        }

        public void setUserId(Long userId) {
            this.userId = userId;
        }
    }

    static final class Comment {
        private Long id;
        private String body;
        private Long postId;

        public Long getId() {
            return id;
        }

        public void setId(Long id) {
            this.id = id;
        }

        public String getBody() {
            return body;
        }

        public void setBody(String body) {
            this.body = body;
        }

        public Long getPostId() {
            return postId;
        }

        public void setPostId(Long postId) {
            this.postId = postId;
        }
    }
}
