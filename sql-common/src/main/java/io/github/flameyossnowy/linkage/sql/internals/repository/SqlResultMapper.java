package io.github.flameyossnowy.linkage.sql.internals.repository;

import io.github.flameyossnowy.linkage.api.connection.Row;
import org.jetbrains.annotations.NotNull;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies result sets into {@link Row}s keyed by column label, so aliases chosen in the SQL survive.
 */
public final class SqlResultMapper {
    private SqlResultMapper() {}

    public static @NotNull List<Row> map(@NotNull ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        String[] labels = new String[columnCount];
        for (int i = 0; i < columnCount; i++) {
            labels[i] = metaData.getColumnLabel(i + 1);
        }

        List<Row> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> values = new LinkedHashMap<>(columnCount * 2);
            for (int i = 0; i < columnCount; i++) {
                values.put(labels[i], resultSet.getObject(i + 1));
            }
            rows.add(new Row(values));
        }
        return rows;
    }

    /**
     * The first column of the first row as a number, or 0 when the result is empty.
     */
    public static long mapScalar(@NotNull ResultSet resultSet) throws SQLException {
        if (!resultSet.next()) return 0;
        Object value = resultSet.getObject(1);
        if (value == null) return 0;
        if (value instanceof Number number) return number.longValue();
        return Long.parseLong(value.toString());
    }
}
