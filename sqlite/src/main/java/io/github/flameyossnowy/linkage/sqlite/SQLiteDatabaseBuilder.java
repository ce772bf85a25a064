package io.github.flameyossnowy.linkage.sqlite;

import io.github.flameyossnowy.linkage.api.connection.DatabaseConnection;
import io.github.flameyossnowy.linkage.api.exceptions.MissingConfigurationException;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import io.github.flameyossnowy.linkage.sql.JdbcDatabaseConnection;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.linkage.sql.internals.SimpleConnectionProvider;
import io.github.flameyossnowy.linkage.sql.internals.SqlConnectionProvider;
import io.github.flameyossnowy.linkage.sqlite.credentials.SQLiteCredentials;
import org.jetbrains.annotations.NotNull;

import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Builds a {@link DatabaseConnection} backed by an SQLite file.
 *
 * <pre>{@code
 * DatabaseConnection connection = SQLiteDatabaseBuilder.create()
 *     .withCredentials(new SQLiteCredentials("blog.db"))
 *     .withForeignKeys(true)
 *     .build();
 * }</pre>
 */
public class SQLiteDatabaseBuilder {
    private static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5000;

    private SQLiteCredentials credentials;
    private Function<SQLiteCredentials, SqlConnectionProvider> connectionProvider;
    private Executor executor;
    private boolean foreignKeys = true;
    private int busyTimeoutMillis = DEFAULT_BUSY_TIMEOUT_MILLIS;

    public static @NotNull SQLiteDatabaseBuilder create() {
        return new SQLiteDatabaseBuilder();
    }

    public SQLiteDatabaseBuilder withCredentials(SQLiteCredentials credentials) {
        this.credentials = credentials;
        return this;
    }

    public SQLiteDatabaseBuilder withConnectionProvider(Function<SQLiteCredentials, SqlConnectionProvider> connectionProvider) {
        this.connectionProvider = connectionProvider;
        return this;
    }

    /**
     * Runs statements on {@code executor} instead of the calling thread.
     */
    public SQLiteDatabaseBuilder withExecutor(Executor executor) {
        this.executor = executor;
        return this;
    }

    public SQLiteDatabaseBuilder withForeignKeys(boolean foreignKeys) {
        this.foreignKeys = foreignKeys;
        return this;
    }

    public SQLiteDatabaseBuilder withBusyTimeout(int busyTimeoutMillis) {
        if (busyTimeoutMillis < 0) {
            throw new IllegalArgumentException("Busy timeout cannot be negative");
        }
        this.busyTimeoutMillis = busyTimeoutMillis;
        return this;
    }

    public @NotNull DatabaseConnection build() {
        if (credentials == null) {
            throw new MissingConfigurationException("SQLite credentials are required");
        }
        SqlConnectionProvider provider = connectionProvider != null
            ? connectionProvider.apply(credentials)
            : new SimpleConnectionProvider(credentials.url(), properties());

        Logging.info(() -> "Using SQLite database at " + credentials.path());
        return new JdbcDatabaseConnection(provider, QueryParseEngine.SQLType.SQLITE, executor);
    }

    private Properties properties() {
        Properties properties = new Properties();
        // sqlite-jdbc applies these as pragmas on every new connection
        properties.setProperty("foreign_keys", String.valueOf(foreignKeys));
        properties.setProperty("busy_timeout", String.valueOf(busyTimeoutMillis));
        return properties;
    }
}
