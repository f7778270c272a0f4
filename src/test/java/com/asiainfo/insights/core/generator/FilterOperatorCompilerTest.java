package com.asiainfo.insights.core.generator;

import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.exception.UnsupportedOperatorException;
import com.asiainfo.insights.core.model.DateEncoding;
import com.asiainfo.insights.core.model.FilterValueType;
import com.asiainfo.insights.core.model.InsightType;
import com.asiainfo.insights.core.model.SqlFragment;
import com.asiainfo.insights.core.model.SqlRequest;
import com.asiainfo.insights.infra.persistence.DuckDbTestSupport;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FilterOperatorCompilerTest {

    private static DuckDbTestSupport duckdb;

    @BeforeAll
    public static void setUp() throws Exception {
        duckdb = DuckDbTestSupport.open().execute(
                "CREATE TABLE t (id INTEGER, s VARCHAR, n BIGINT, ts BIGINT)",
                // 2025-08-01T00:00:00Z = 1754006400000
                "INSERT INTO t VALUES "
                        + "(1, 'apple', 5, 1754006400000), "
                        + "(2, 'banana', 10, 1754092800000), "
                        + "(3, '100%_off', 15, 1754179200000), "
                        + "(4, NULL, NULL, NULL)");
    }

    @AfterAll
    public static void tearDown() {
        duckdb.close();
    }

    @Test
    public void testComparisonText() {
        SqlFragment eq = FilterOperatorCompiler.compile(FilterValueType.STRING, "equals", "chrome", "\"browser\"");
        assertEquals("\"browser\" = ?", eq.sql());
        assertEquals(List.of("chrome"), eq.params());

        SqlFragment gt = FilterOperatorCompiler.compile(FilterValueType.NUMBER, ">", "100", "\"amount\"");
        assertEquals("\"amount\" > ?", gt.sql());
        assertEquals(List.of(100L), gt.params());

        SqlFragment ne = FilterOperatorCompiler.compile(FilterValueType.NUMBER, "not_equals", 1.5, "\"amount\"");
        assertEquals("\"amount\" <> ?", ne.sql());
    }

    @Test
    public void testContainsEscapesWildcards() {
        SqlFragment contains = FilterOperatorCompiler.compile(FilterValueType.STRING, "contains", "100%_off!",
                "\"title\"");
        assertEquals("\"title\" LIKE ? ESCAPE '!'", contains.sql());
        assertEquals(List.of("%100!%!_off!!%"), contains.params());
    }

    @Test
    public void testEmptyInList() {
        assertEquals("1 = 0", FilterOperatorCompiler.compile(FilterValueType.STRING, "in", List.of(), "\"s\"").sql());
        assertEquals("1 = 1",
                FilterOperatorCompiler.compile(FilterValueType.STRING, "not in", List.of(), "\"s\"").sql());
    }

    @Test
    public void testDateOperandsFollowColumnEncoding() {
        ZoneId shanghai = ZoneId.of("Asia/Shanghai");
        SqlFragment ms = FilterOperatorCompiler.compile(FilterValueType.DATE, ">=", "2025-08-01", "\"ts\"",
                DateEncoding.TIMESTAMP_MS, shanghai);
        // 上海 2025-08-01 00:00 = UTC 2025-07-31 16:00
        assertEquals(List.of(1754006400000L - 8 * 3600_000L), ms.params());

        SqlFragment seconds = FilterOperatorCompiler.compile(FilterValueType.DATE, "<", 1754006400000L, "\"ts\"",
                DateEncoding.TIMESTAMP, ZoneOffset.UTC);
        assertEquals(List.of(1754006400L), seconds.params());

        SqlFragment datetime = FilterOperatorCompiler.compile(FilterValueType.DATE, "=",
                "2025-08-01T10:15:30Z", "\"dt\"", DateEncoding.DATETIME, shanghai);
        assertEquals(List.of("2025-08-01 10:15:30"), datetime.params());
    }

    @Test
    public void testRejectsUnknownOrMismatchedOperator() {
        assertThrows(UnsupportedOperatorException.class,
                () -> FilterOperatorCompiler.compile(FilterValueType.STRING, "regex", "a", "\"s\""));
        assertThrows(UnsupportedOperatorException.class,
                () -> FilterOperatorCompiler.compile(FilterValueType.STRING, ">", "a", "\"s\""));
        assertThrows(UnsupportedOperatorException.class,
                () -> FilterOperatorCompiler.compile(FilterValueType.NUMBER, "contains", 1, "\"n\""));
    }

    @Test
    public void testRejectsMalformedOperands() {
        assertThrows(InvalidQueryException.class,
                () -> FilterOperatorCompiler.compile(FilterValueType.NUMBER, "between", List.of(1), "\"n\""));
        assertThrows(InvalidQueryException.class,
                () -> FilterOperatorCompiler.compile(FilterValueType.NUMBER, "=", "ten", "\"n\""));
        assertThrows(InvalidQueryException.class,
                () -> FilterOperatorCompiler.compile(FilterValueType.DATE, "=", "yesterday", "\"d\""));
        assertThrows(InvalidQueryException.class,
                () -> FilterOperatorCompiler.compile(FilterValueType.STRING, "=", null, "\"s\""));
    }

    @Test
    public void testOperatorsAgainstDuckDb() {
        assertEquals(List.of(1), ids(FilterValueType.STRING, "equals", "apple", "s"));
        assertEquals(List.of(2, 3), ids(FilterValueType.STRING, "!=", "apple", "s"));
        assertEquals(List.of(2), ids(FilterValueType.STRING, "contains", "nan", "s"));
        assertEquals(List.of(3), ids(FilterValueType.STRING, "contains", "%_", "s"));
        assertEquals(List.of(1, 2), ids(FilterValueType.STRING, "not contains", "%", "s"));
        assertEquals(List.of(2, 3), ids(FilterValueType.NUMBER, "greater than", 5, "n"));
        assertEquals(List.of(1, 2), ids(FilterValueType.NUMBER, "<=", 10, "n"));
        assertEquals(List.of(1, 2), ids(FilterValueType.NUMBER, "between", List.of(5, 10), "n"));
        assertEquals(List.of(1, 3), ids(FilterValueType.NUMBER, "in list", List.of(5, 15), "n"));
        assertEquals(List.of(2), ids(FilterValueType.NUMBER, "not in", List.of(5, 15), "n"));
        assertEquals(List.of(), ids(FilterValueType.NUMBER, "in", List.of(), "n"));
        assertEquals(List.of(4), ids(FilterValueType.STRING, "is null", null, "s"));
        assertEquals(List.of(1, 2, 3), ids(FilterValueType.NUMBER, "is not null", null, "n"));
        assertEquals(List.of(2, 3), ids(FilterValueType.DATE, ">", "2025-08-01", "ts"));
    }

    private List<Integer> ids(FilterValueType type, String operator, Object value, String column) {
        SqlFragment predicate = FilterOperatorCompiler.compile(type, operator, value,
                SafeIdentifier.of(column).quoted(), DateEncoding.TIMESTAMP_MS, ZoneOffset.UTC);
        SqlFragment statement = SqlFragment.raw("SELECT id FROM t WHERE ").append(predicate).append(" ORDER BY id");
        List<Map<String, Object>> rows = duckdb.executor()
                .execute(duckdb.target(InsightType.INTERNAL, null), "test", SqlRequest.of(statement));
        return rows.stream().map(row -> ((Number) row.get("id")).intValue()).collect(Collectors.toList());
    }
}
