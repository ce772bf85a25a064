import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.flameyossnowy.linkage.api.options.FieldOp;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.JsonNullKind;
import io.github.flameyossnowy.linkage.api.options.Query;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine.SQLType;
import io.github.flameyossnowy.linkage.sql.internals.query.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlJsonRenderingTest {
    private static final String SELECT_SQLITE = "SELECT \"accounts\".* FROM \"accounts\" WHERE ";

    private static SqlStatement render(SQLType type, Filter filter) {
        return new QueryParseEngine(type).parseSelect(Query.select(Accounts.ACCOUNTS).where(filter).build());
    }

    @Test
    void sqlite_path_equality_binds_path_then_value() {
        SqlStatement statement = render(SQLType.SQLITE, Filter.json("data", List.of("profile", "tier"), new FieldOp.Equals("gold")));

        assertEquals(SELECT_SQLITE + "json_extract(\"accounts\".\"data\", ?) = ?", statement.sql());
        assertEquals(List.of("$.\"profile\".\"tier\"", "gold"), statement.params());
    }

    @Test
    void numeric_path_segments_become_array_indexes() {
        SqlStatement statement = render(SQLType.SQLITE, Filter.json("data", List.of("tags", "0"), new FieldOp.Equals("a")));

        assertEquals("$.\"tags\"[0]", statement.params().get(0));
    }

    @Test
    void sqlite_json_booleans_compare_as_integers() {
        SqlStatement statement = render(SQLType.SQLITE, Filter.json("data", List.of("active"), new FieldOp.Equals(JsonNodeFactory.instance.booleanNode(true))));

        assertEquals(List.of("$.\"active\"", 1), statement.params());
    }

    @Test
    void postgres_path_uses_text_array() {
        SqlStatement statement = render(SQLType.POSTGRESQL, Filter.json("data", List.of("profile", "tier"), new FieldOp.Equals("gold")));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE (\"accounts\".\"data\"::jsonb #>> ?::text[]) = ?", statement.sql());
        assertEquals(List.of("{\"profile\",\"tier\"}", "gold"), statement.params());
    }

    @Test
    void postgres_numeric_comparison_casts_extracted_text() {
        SqlStatement statement = render(SQLType.POSTGRESQL, Filter.json("data", List.of("score"), new FieldOp.Gt(5)));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE (\"accounts\".\"data\"::jsonb #>> ?::text[])::numeric > ?", statement.sql());
    }

    @Test
    void mysql_path_unquotes_extracted_value() {
        SqlStatement statement = render(SQLType.MYSQL, Filter.json("data", List.of("tier"), new FieldOp.Equals("gold")));

        assertEquals("SELECT `accounts`.* FROM `accounts` WHERE JSON_UNQUOTE(JSON_EXTRACT(`accounts`.`data`, ?)) = ?", statement.sql());
    }

    @Test
    void sqlite_array_contains_scans_json_each() {
        SqlStatement statement = render(SQLType.SQLITE, Filter.jsonArrayContains("data", JsonNodeFactory.instance.textNode("x")));

        assertEquals(SELECT_SQLITE + "EXISTS (SELECT 1 FROM json_each(\"accounts\".\"data\", ?) WHERE json_each.value = ?)", statement.sql());
        assertEquals(List.of("$", "x"), statement.params());
    }

    @Test
    void postgres_array_contains_uses_containment() {
        SqlStatement statement = render(SQLType.POSTGRESQL, Filter.jsonArrayContains("data", JsonNodeFactory.instance.numberNode(3)));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE (\"accounts\".\"data\"::jsonb) @> ?::jsonb", statement.sql());
        assertEquals(List.of("[3]"), statement.params());
    }

    @Test
    void sqlite_object_contains_checks_key_type() {
        SqlStatement statement = render(SQLType.SQLITE, Filter.jsonObjectContains("data", "tier"));

        assertEquals(SELECT_SQLITE + "json_type(\"accounts\".\"data\", ?) IS NOT NULL", statement.sql());
        assertEquals(List.of("$.\"tier\""), statement.params());
    }

    @Test
    void json_null_kinds_distinguish_database_null() {
        assertEquals(SELECT_SQLITE + "\"accounts\".\"data\" IS NULL",
            render(SQLType.SQLITE, Filter.jsonNull("data", JsonNullKind.DB_NULL)).sql());

        SqlStatement any = render(SQLType.SQLITE, Filter.jsonNull("data", JsonNullKind.ANY_NULL));
        assertEquals(SELECT_SQLITE + "(\"accounts\".\"data\" IS NULL OR json_type(\"accounts\".\"data\", ?) = 'null')", any.sql());
        assertEquals(List.of("$"), any.params());
    }

    @Test
    void insensitive_json_string_contains_uses_like() {
        SqlStatement statement = render(SQLType.SQLITE,
            new Filter("data", new FieldOp.JsonPath(List.of("name"), new FieldOp.JsonStringContains("Al"))).insensitive());

        assertEquals(SELECT_SQLITE + "LOWER(json_extract(\"accounts\".\"data\", ?)) LIKE LOWER(?) ESCAPE '\\'", statement.sql());
        assertEquals(List.of("$.\"name\"", "%Al%"), statement.params());
    }
}
