package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ConnectionException;
import com.enterprise.morpher.migration.domain.JoinSpec;
import com.enterprise.morpher.migration.domain.QueryException;
import com.enterprise.morpher.migration.domain.SourceRow;
import com.enterprise.morpher.shared.querybridge.adapter.JdbcDatabaseConnection;
import com.enterprise.morpher.sql.core.Dialects;
import com.enterprise.morpher.sql.core.JoinType;
import com.enterprise.morpher.sql.core.QualifiedColumn;
import com.enterprise.morpher.support.FaultInjectingConnection;
import com.enterprise.morpher.support.TestDatabases;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JdbcPageSourceTest {

    private static final JoinPlan PLAN = new JoinPlan("users",
            List.of(new JoinSpec("profiles", "users.id = profiles.user_id", JoinType.LEFT)));

    private EmbeddedDatabase db;
    private JdbcTemplate jdbc;
    private FaultInjectingConnection source;

    @BeforeEach
    void setUp() {
        db = TestDatabases.h2();
        jdbc = new JdbcTemplate(db);
        TestDatabases.createUsersAndProfiles(jdbc);
        source = new FaultInjectingConnection(new JdbcDatabaseConnection("source", db));
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private JdbcPageSource pages(int pageSize) {
        CompiledQuery query = new QueryCompiler().compile(PLAN, List.of(
                QualifiedColumn.parse("users.id"),
                QualifiedColumn.parse("users.username"),
                QualifiedColumn.parse("profiles.phone")), pageSize, Dialects.H2);
        return new JdbcPageSource(source, query, Duration.ZERO);
    }

    @Test
    void testLeftJoinRowsKeyedByQualifiedColumn() {
        List<SourceRow> rows = pages(10).nextPage();

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).columns()).containsExactly("users.id", "users.username", "profiles.phone");
        assertThat(rows.get(0).valueOf("profiles.phone")).isEqualTo("555");
        assertThat(rows.get(1).get("profiles.phone").isAbsent()).isTrue();
    }

    @Test
    void testShortPageEndsRead() {
        jdbc.update("INSERT INTO users VALUES (3, 'c')");
        JdbcPageSource pages = pages(2);

        assertThat(pages.nextPage()).hasSize(2);
        assertThat(pages.nextPage()).hasSize(1);
        assertThat(pages.nextPage()).isNull();
        assertThat(source.queryCalls()).isEqualTo(2);
    }

    @Test
    void testFullLastPageNeedsOneMoreRoundTrip() {
        JdbcPageSource pages = pages(2);

        assertThat(pages.nextPage()).hasSize(2);
        assertThat(pages.nextPage()).isEmpty();
        assertThat(pages.nextPage()).isNull();
    }

    @Test
    void testUnpagedReadsOnce() {
        JdbcPageSource pages = pages(0);

        assertThat(pages.nextPage()).hasSize(2);
        assertThat(pages.nextPage()).isNull();
        assertThat(source.queryCalls()).isEqualTo(1);
    }

    @Test
    void testFailedPageRetriedOnce() {
        source.failQueryCalls(1);

        assertThat(pages(10).nextPage()).hasSize(2);
        assertThat(source.queryCalls()).isEqualTo(2);
    }

    @Test
    void testQueryFailureAfterRetry() {
        source.failAllQueries();

        assertThatThrownBy(() -> pages(10).nextPage())
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("failed after retry")
                .hasMessageContaining("injected failure");
        assertThat(source.queryCalls()).isEqualTo(2);
    }

    @Test
    void testConnectionFailureAfterRetry() {
        source.failAllQueries().with(() -> new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> pages(10).nextPage()).isInstanceOf(ConnectionException.class);
    }
}
