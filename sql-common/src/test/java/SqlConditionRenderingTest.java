import io.github.flameyossnowy.linkage.api.options.CountQuery;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.Query;
import io.github.flameyossnowy.linkage.api.options.RelationQuantifier;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.linkage.sql.internals.query.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlConditionRenderingTest {
    private final QueryParseEngine sqlite = new QueryParseEngine(QueryParseEngine.SQLType.SQLITE);
    private final QueryParseEngine postgres = new QueryParseEngine(QueryParseEngine.SQLType.POSTGRESQL);

    @Test
    void sqlite_case_sensitive_contains_uses_glob() {
        SqlStatement statement = sqlite.parseSelect(select(Filter.contains("name", "a*b")));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE \"accounts\".\"name\" GLOB ?", statement.sql());
        assertEquals(List.of("*a[*]b*"), statement.params());
    }

    @Test
    void insensitive_contains_lowers_both_sides() {
        SqlStatement statement = sqlite.parseSelect(select(Filter.contains("name", "a_b").insensitive()));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE LOWER(\"accounts\".\"name\") LIKE LOWER(?) ESCAPE '\\'", statement.sql());
        assertEquals(List.of("%a\\_b%"), statement.params());
    }

    @Test
    void postgres_starts_with_uses_like() {
        SqlStatement statement = postgres.parseSelect(select(Filter.startsWith("name", "Jo")));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE \"accounts\".\"name\" LIKE ? ESCAPE '\\'", statement.sql());
        assertEquals(List.of("Jo%"), statement.params());
    }

    @Test
    void null_equality_and_empty_lists_have_fixed_forms() {
        SqlStatement statement = sqlite.parseSelect(select(Filter.equals("name", null), Filter.in("id", List.of()), Filter.notIn("id", List.of())));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE \"accounts\".\"name\" IS NULL AND 1 = 0 AND 1 = 1", statement.sql());
        assertTrue(statement.params().isEmpty());
    }

    @Test
    void boolean_groups_keep_parameter_order() {
        SqlStatement statement = sqlite.parseSelect(select(
            WhereParam.or(Filter.equals("email", "a@x"), WhereParam.not(Filter.gt("id", 5L)))
        ));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE (\"accounts\".\"email\" = ? OR NOT (\"accounts\".\"id\" > ?))", statement.sql());
        assertEquals(List.of("a@x", 5L), statement.params());
    }

    @Test
    void some_relation_renders_correlated_exists() {
        SqlStatement statement = sqlite.parseSelect(select(relation(RelationQuantifier.SOME)));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE EXISTS (SELECT 1 FROM \"orders\" \"r1\" WHERE \"r1\".\"account_id\" = \"accounts\".\"id\" AND (\"r1\".\"total\" > ?))", statement.sql());
        assertEquals(List.of(10.0), statement.params());
    }

    @Test
    void every_relation_means_no_related_row_fails() {
        SqlStatement statement = sqlite.parseSelect(select(relation(RelationQuantifier.EVERY)));

        assertEquals("SELECT \"accounts\".* FROM \"accounts\" WHERE NOT EXISTS (SELECT 1 FROM \"orders\" \"r1\" WHERE \"r1\".\"account_id\" = \"accounts\".\"id\" AND NOT (\"r1\".\"total\" > ?))", statement.sql());
    }

    @Test
    void none_relation_is_not_exists() {
        SqlStatement statement = sqlite.parseSelect(select(relation(RelationQuantifier.NONE)));

        assertTrue(statement.sql().contains("WHERE NOT EXISTS (SELECT 1 FROM \"orders\" \"r1\""), statement.sql());
        assertFalse(statement.sql().contains("AND NOT ("), statement.sql());
    }

    @Test
    void count_renders_filters() {
        SqlStatement statement = sqlite.parseCount(new CountQuery(Accounts.ACCOUNTS, List.of(Filter.equals("email", "a@x"))));

        assertEquals("SELECT COUNT(*) FROM \"accounts\" WHERE \"accounts\".\"email\" = ?", statement.sql());
    }

    private static WhereParam relation(RelationQuantifier quantifier) {
        return new WhereParam.ResolvedRelationCondition(Accounts.ORDERS, "account_id", "id", quantifier, List.of(Filter.gt("total", 10.0)));
    }

    private static SelectQuery select(WhereParam... filters) {
        return Query.select(Accounts.ACCOUNTS).where(List.of(filters)).build();
    }
}
