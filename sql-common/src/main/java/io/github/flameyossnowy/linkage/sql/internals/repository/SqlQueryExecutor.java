package io.github.flameyossnowy.linkage.sql.internals.repository;

import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.DatabaseException;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.options.InsertQuery;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.linkage.sql.internals.SqlConnectionProvider;
import io.github.flameyossnowy.linkage.sql.internals.query.SqlStatement;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Runs rendered statements on a caller-supplied JDBC connection. Driver failures surface as
 * {@link DatabaseException}s carrying the SQL that failed.
 */
public final class SqlQueryExecutor {
    private final SqlConnectionProvider dataSource;
    private final QueryParseEngine.SQLType sqlType;

    public SqlQueryExecutor(@NotNull SqlConnectionProvider dataSource, @NotNull QueryParseEngine.SQLType sqlType) {
        this.dataSource = dataSource;
        this.sqlType = sqlType;
    }

    public @NotNull List<Row> executeQuery(@NotNull Connection connection, @NotNull SqlStatement statement) {
        Logging.deepInfo(() -> "Executing query: " + statement.sql() + " " + statement.params());
        try (PreparedStatement prepared = dataSource.prepareStatement(statement.sql(), connection)) {
            SqlParameterBinder.bind(prepared, statement.params());
            try (ResultSet resultSet = prepared.executeQuery()) {
                return SqlResultMapper.map(resultSet);
            }
        } catch (SQLException e) {
            throw failure(statement, e);
        }
    }

    public long executeScalar(@NotNull Connection connection, @NotNull SqlStatement statement) {
        Logging.deepInfo(() -> "Executing query: " + statement.sql() + " " + statement.params());
        try (PreparedStatement prepared = dataSource.prepareStatement(statement.sql(), connection)) {
            SqlParameterBinder.bind(prepared, statement.params());
            try (ResultSet resultSet = prepared.executeQuery()) {
                return SqlResultMapper.mapScalar(resultSet);
            }
        } catch (SQLException e) {
            throw failure(statement, e);
        }
    }

    public long executeUpdate(@NotNull Connection connection, @NotNull SqlStatement statement) {
        Logging.deepInfo(() -> "Executing update: " + statement.sql() + " " + statement.params());
        try (PreparedStatement prepared = dataSource.prepareStatement(statement.sql(), connection)) {
            SqlParameterBinder.bind(prepared, statement.params());
            return prepared.executeUpdate();
        } catch (SQLException e) {
            throw failure(statement, e);
        }
    }

    /**
     * Inserts a row and returns its key: the explicit primary key value when the insert carries one,
     * the generated key otherwise.
     */
    public @NotNull Optional<Object> executeInsert(@NotNull Connection connection, @NotNull InsertQuery query, @NotNull SqlStatement statement) {
        Logging.deepInfo(() -> "Executing insert: " + statement.sql() + " " + statement.params());
        FieldModel<?> primaryKey = query.model().getPrimaryKey();
        Object explicit = query.values().get(primaryKey.columnName());

        String generatedKeyQuery = sqlType.generatedKeyQuery();
        try (PreparedStatement prepared = generatedKeyQuery == null && explicit == null
            ? dataSource.prepareInsert(statement.sql(), connection)
            : dataSource.prepareStatement(statement.sql(), connection)) {
            SqlParameterBinder.bind(prepared, statement.params());
            prepared.executeUpdate();

            if (explicit != null) {
                return Optional.of(explicit);
            }
            if (generatedKeyQuery != null) {
                try (PreparedStatement keyStatement = dataSource.prepareStatement(generatedKeyQuery, connection);
                     ResultSet keys = keyStatement.executeQuery()) {
                    return keys.next() ? Optional.ofNullable(keys.getObject(1)) : Optional.empty();
                }
            }
            try (ResultSet keys = prepared.getGeneratedKeys()) {
                return keys.next() ? Optional.ofNullable(keys.getObject(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw failure(statement, e);
        }
    }

    private static DatabaseException failure(SqlStatement statement, SQLException e) {
        Logging.info(() -> "Statement failed: " + statement.sql() + " (" + e.getMessage() + ")");
        return new DatabaseException("Failed to execute '" + statement.sql() + "': " + e.getMessage(), e);
    }
}
