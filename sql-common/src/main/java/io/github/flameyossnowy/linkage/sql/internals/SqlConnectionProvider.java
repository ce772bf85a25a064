package io.github.flameyossnowy.linkage.sql.internals;

import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Source of JDBC connections for a database.
 */
public interface SqlConnectionProvider extends AutoCloseable {
    @NotNull Connection getConnection() throws SQLException;

    default @NotNull PreparedStatement prepareStatement(@NotNull String sql, @NotNull Connection connection) throws SQLException {
        return connection.prepareStatement(sql);
    }

    default @NotNull PreparedStatement prepareInsert(@NotNull String sql, @NotNull Connection connection) throws SQLException {
        return connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
    }

    @Override
    default void close() {}
}
