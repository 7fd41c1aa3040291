package com.enterprise.morpher.sql.builder;

import com.enterprise.morpher.sql.debug.QueryDebugger;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SqlResultTest {

    @Test
    void testVerifyDetectsUnboundParameter() {
        SqlResult r = new SqlResult("SELECT t.a FROM t WHERE t.b = :b_1", Map.of());

        assertThatThrownBy(r::verify)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(":b_1");
    }

    @Test
    void testVerifyIgnoresPostgresCast() {
        SqlResult r = new SqlResult("SELECT t.a::text FROM t", Map.of());

        assertThatCode(r::verify).doesNotThrowAnyException();
    }

    @Test
    void testDebugStringDoesNotReplacePrefixOfLongerName() {
        Map<String, Object> params = new HashMap<>();
        params.put("id_1", 1);
        params.put("id_10", 10);
        SqlResult r = new SqlResult("VALUES (:id_1), (:id_10)", params);

        assertThat(r.toDebugString()).isEqualTo("VALUES (1), (10)");
    }

    @Test
    void testDebuggerGroupsValuesByRow() {
        SqlResult r = InsertBuilder.insert()
                .into("t")
                .columns("id", "d")
                .valuesOrNull(1, LocalDate.of(2024, 3, 15))
                .valuesOrNull(2, null)
                .build();

        String out = QueryDebugger.format("batch 1 into 't'", r);

        assertThat(out).isEqualTo(String.join("\n",
                "-- batch 1 into 't' (2 rows, 3 parameters)",
                "INSERT INTO t (id, d) VALUES (:id_1, :d_1), (:id_2, NULL)",
                "-- inlined: INSERT INTO t (id, d) VALUES (1, DATE '2024-03-15'), (2, NULL)",
                "--   row 1: id=1 (Integer), d=2024-03-15 (LocalDate)",
                "--   row 2: id=2 (Integer)"));
    }

    @Test
    void testDebuggerWithoutParameters() {
        SqlResult r = new SqlResult("SELECT t.a FROM t", Map.of());

        assertThat(QueryDebugger.format("read 'users'", r))
                .isEqualTo("-- read 'users' (no parameters)\nSELECT t.a FROM t");
    }
}
