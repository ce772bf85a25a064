import io.github.flameyossnowy.linkage.api.builder.LinkageClient;
import io.github.flameyossnowy.linkage.api.connection.DatabaseConnection;
import io.github.flameyossnowy.linkage.sqlite.SQLiteDatabaseBuilder;
import io.github.flameyossnowy.linkage.sqlite.credentials.SQLiteCredentials;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A blog schema in a fresh SQLite file.
 */
final class SQLiteTestDatabase implements AutoCloseable {
    private static final String[] SCHEMA = {
        "CREATE TABLE users (id INTEGER PRIMARY KEY AUTOINCREMENT, email TEXT NOT NULL UNIQUE, name TEXT NOT NULL, age INTEGER, profile TEXT)",
        "CREATE TABLE posts (id INTEGER PRIMARY KEY AUTOINCREMENT, title TEXT NOT NULL, views INTEGER NOT NULL DEFAULT 0, "
            + "user_id INTEGER REFERENCES users(id))",
        "CREATE TABLE comments (id INTEGER PRIMARY KEY AUTOINCREMENT, body TEXT NOT NULL, "
            + "post_id INTEGER NOT NULL REFERENCES posts(id) ON DELETE CASCADE)"
    };

    final DatabaseConnection connection;
    final LinkageClient client;

    private SQLiteTestDatabase(DatabaseConnection connection) {
        this.connection = connection;
        this.client = LinkageClient.builder().withRegistry(Blog.registry()).withConnection(connection).build();
    }

    static SQLiteTestDatabase create(Path directory) throws SQLException {
        String path = directory.resolve("blog.db").toString();
        try (Connection jdbc = DriverManager.getConnection("jdbc:sqlite:" + path);
             Statement statement = jdbc.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        }
        return new SQLiteTestDatabase(SQLiteDatabaseBuilder.create()
            .withCredentials(new SQLiteCredentials(path))
            .build());
    }

    @Override
    public void close() {
        connection.close();
    }
}
