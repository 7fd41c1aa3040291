package com.enterprise.morpher.sql.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class DialectsTest {

    @ParameterizedTest
    @CsvSource({
            "H2, H2",
            "PostgreSQL, PostgreSQL",
            "MySQL, MySQL",
            "MariaDB, MySQL",
            "SQLite, SQLite",
            "Oracle, Oracle",
            "Microsoft SQL Server, SQL Server",
            "Apache Derby, ANSI"})
    void testDetectionFromProductName(String product, String dialect) {
        assertThat(Dialects.forProductName(product).name()).isEqualTo(dialect);
    }

    @Test
    void testNullProductIsAnsi() {
        assertThat(Dialects.forProductName(null)).isSameAs(Dialects.ANSI);
    }

    @Test
    void testJoinSupport() {
        assertThat(Dialects.POSTGRESQL.supportsJoin(JoinType.FULL)).isTrue();
        assertThat(Dialects.MYSQL.supportsJoin(JoinType.FULL)).isFalse();
        assertThat(Dialects.SQLITE.supportsJoin(JoinType.RIGHT)).isFalse();
        assertThat(Dialects.SQLITE.supportsJoin(JoinType.LEFT)).isTrue();
    }

    @Test
    void testUpsertStyles() {
        assertThat(Dialects.H2.upsertStyle()).isEqualTo(UpsertStyle.MERGE_KEY);
        assertThat(Dialects.POSTGRESQL.upsertStyle()).isEqualTo(UpsertStyle.ON_CONFLICT);
        assertThat(Dialects.MYSQL.upsertStyle()).isEqualTo(UpsertStyle.ON_DUPLICATE_KEY);
        assertThat(Dialects.ORACLE.upsertStyle()).isEqualTo(UpsertStyle.NONE);
        assertThat(Dialects.ORACLE.supportsMultiRowValues()).isFalse();
    }

    @Test
    void testQualifiedColumnParsing() {
        QualifiedColumn c = QualifiedColumn.parse("sales.orders.id");

        assertThat(c.table()).isEqualTo("sales.orders");
        assertThat(c.column()).isEqualTo("id");
        assertThat(c.refAs("c1_id")).isEqualTo("sales.orders.id AS c1_id");
        assertThat(c.belongsTo("SALES.ORDERS")).isTrue();
        assertThatThrownBy(() -> QualifiedColumn.parse("id"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("table-qualified");
    }
}
