package io.github.flameyossnowy.linkage.sql.internals;

import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens a new {@link DriverManager} connection for each request.
 */
public class SimpleConnectionProvider implements SqlConnectionProvider {
    private final String url;
    private final Properties properties;

    public SimpleConnectionProvider(@NotNull String url, @NotNull Properties properties) {
        this.url = url;
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    @Override
    public @NotNull Connection getConnection() throws SQLException {
        Logging.deepInfo(() -> "Opening connection to " + url);
        return DriverManager.getConnection(url, properties);
    }

    public @NotNull String url() {
        return url;
    }
}
