import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.DatabaseException;
import io.github.flameyossnowy.linkage.api.options.InsertQuery;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine.SQLType;
import io.github.flameyossnowy.linkage.sql.internals.SqlConnectionProvider;
import io.github.flameyossnowy.linkage.sql.internals.query.SqlStatement;
import io.github.flameyossnowy.linkage.sql.internals.repository.SqlQueryExecutor;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SqlQueryExecutorTest {
    private static final String INSERT = "INSERT INTO \"accounts\" (\"email\") VALUES (?)";

    private final Connection connection = mock(Connection.class);
    private final SqlConnectionProvider provider = () -> connection;

    @Test
    void sqlite_insert_reads_last_rowid_on_same_connection() throws SQLException {
        PreparedStatement insert = mock(PreparedStatement.class);
        PreparedStatement keyQuery = mock(PreparedStatement.class);
        ResultSet keys = mock(ResultSet.class);
        when(connection.prepareStatement(INSERT)).thenReturn(insert);
        when(connection.prepareStatement("SELECT last_insert_rowid()")).thenReturn(keyQuery);
        when(keyQuery.executeQuery()).thenReturn(keys);
        when(keys.next()).thenReturn(true);
        when(keys.getObject(1)).thenReturn(7L);

        SqlQueryExecutor executor = new SqlQueryExecutor(provider, SQLType.SQLITE);
        Optional<Object> key = executor.executeInsert(connection,
            new InsertQuery(Accounts.ACCOUNTS, Map.of("email", "a@x")), new SqlStatement(INSERT, List.of("a@x")));

        assertEquals(Optional.of(7L), key);
        verify(insert).setObject(1, "a@x");
        verify(insert).executeUpdate();
    }

    @Test
    void explicit_key_is_returned_without_asking_the_driver() throws SQLException {
        PreparedStatement insert = mock(PreparedStatement.class);
        when(connection.prepareStatement(anyString())).thenReturn(insert);

        SqlQueryExecutor executor = new SqlQueryExecutor(provider, SQLType.SQLITE);
        Optional<Object> key = executor.executeInsert(connection,
            new InsertQuery(Accounts.ACCOUNTS, Map.of("id", 5L)), new SqlStatement("INSERT INTO \"accounts\" (\"id\") VALUES (?)", List.of(5L)));

        assertEquals(Optional.of(5L), key);
        verify(connection, never()).prepareStatement("SELECT last_insert_rowid()");
        verify(insert, never()).getGeneratedKeys();
    }

    @Test
    void mysql_insert_uses_generated_keys() throws SQLException {
        PreparedStatement insert = mock(PreparedStatement.class);
        ResultSet keys = mock(ResultSet.class);
        when(connection.prepareStatement(INSERT, Statement.RETURN_GENERATED_KEYS)).thenReturn(insert);
        when(insert.getGeneratedKeys()).thenReturn(keys);
        when(keys.next()).thenReturn(true);
        when(keys.getObject(1)).thenReturn(11L);

        SqlQueryExecutor executor = new SqlQueryExecutor(provider, SQLType.MYSQL);

        assertEquals(Optional.of(11L), executor.executeInsert(connection,
            new InsertQuery(Accounts.ACCOUNTS, Map.of("email", "a@x")), new SqlStatement(INSERT, List.of("a@x"))));
    }

    @Test
    void null_parameters_bind_as_sql_null() throws SQLException {
        PreparedStatement update = mock(PreparedStatement.class);
        when(connection.prepareStatement(anyString())).thenReturn(update);
        when(update.executeUpdate()).thenReturn(3);

        SqlQueryExecutor executor = new SqlQueryExecutor(provider, SQLType.SQLITE);
        List<Object> params = new ArrayList<>();
        params.add(null);

        assertEquals(3, executor.executeUpdate(connection, new SqlStatement("UPDATE \"accounts\" SET \"name\" = ?", params)));
        verify(update).setNull(1, Types.NULL);
    }

    @Test
    void query_rows_are_keyed_by_column_label() throws SQLException {
        PreparedStatement select = mock(PreparedStatement.class);
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(connection.prepareStatement(anyString())).thenReturn(select);
        when(select.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(1);
        when(metaData.getColumnLabel(1)).thenReturn("_count");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn(4);

        List<Row> rows = new SqlQueryExecutor(provider, SQLType.SQLITE)
            .executeQuery(connection, new SqlStatement("SELECT COUNT(*) AS \"_count\" FROM \"accounts\"", List.of()));

        assertEquals(1, rows.size());
        assertEquals(4, rows.get(0).get("_count"));
    }

    @Test
    void empty_scalar_result_is_zero() throws SQLException {
        PreparedStatement select = mock(PreparedStatement.class);
        ResultSet resultSet = mock(ResultSet.class);
        when(connection.prepareStatement(anyString())).thenReturn(select);
        when(select.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        assertEquals(0L, new SqlQueryExecutor(provider, SQLType.SQLITE)
            .executeScalar(connection, new SqlStatement("SELECT COUNT(*) FROM \"accounts\"", List.of())));
    }

    @Test
    void driver_failures_carry_the_statement() throws SQLException {
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("no such table: accounts"));

        SqlQueryExecutor executor = new SqlQueryExecutor(provider, SQLType.SQLITE);
        DatabaseException error = assertThrows(DatabaseException.class,
            () -> executor.executeUpdate(connection, new SqlStatement("DELETE FROM \"accounts\"", List.of())));

        assertTrue(error.getMessage().contains("DELETE FROM \"accounts\""), error.getMessage());
        assertInstanceOf(SQLException.class, error.getCause());
    }
}
