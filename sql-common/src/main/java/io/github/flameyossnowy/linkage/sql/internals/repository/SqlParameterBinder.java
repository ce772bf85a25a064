package io.github.flameyossnowy.linkage.sql.internals.repository;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * Binds already converted storage values to {@code ?} placeholders, in order.
 */
public final class SqlParameterBinder {
    private SqlParameterBinder() {}

    public static void bind(@NotNull PreparedStatement statement, @NotNull List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            int index = i + 1;
            if (value == null) {
                statement.setNull(index, Types.NULL);
            } else if (value instanceof BigInteger integer) {
                statement.setBigDecimal(index, new BigDecimal(integer));
            } else if (value instanceof Character character) {
                statement.setString(index, character.toString());
            } else {
                statement.setObject(index, value);
            }
        }
    }
}
