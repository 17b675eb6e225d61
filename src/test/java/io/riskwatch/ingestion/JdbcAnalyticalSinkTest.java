package io.riskwatch.ingestion;

import io.riskwatch.ingestion.api.service.sink.JdbcAnalyticalSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcAnalyticalSinkTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcAnalyticalSink sink;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        sink = new JdbcAnalyticalSink(jdbcTemplate, new DataSourceTransactionManager(database),
                Map.of("analytics_events", "event_id", "ingestion_runs", "run_id"));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void insertsRowsByColumnName() {
        List<String> errors = sink.insertRows("analytics_events", List.of(event("elpais:1"), event("elpais:2")));

        assertThat(errors).isEmpty();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM analytics_events", Integer.class)).isEqualTo(2);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT risk_label FROM analytics_events WHERE event_id = 'elpais:2'", String.class))
                .isEqualTo("High-Legal");
    }

    @Test
    void rewrittenEventReplacesStoredRow() {
        sink.insertRows("analytics_events", List.of(event("elpais:1"), event("elpais:2")));

        Map<String, Object> again = event("elpais:1");
        again.put("risk_label", "Low-Other");
        again.put("alerted", false);
        List<String> errors = sink.insertRows("analytics_events", List.of(again));

        assertThat(errors).isEmpty();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM analytics_events", Integer.class)).isEqualTo(2);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT risk_label FROM analytics_events WHERE event_id = 'elpais:1'", String.class))
                .isEqualTo("Low-Other");
    }

    @Test
    void repeatedKeyWithinBatchKeepsLatestRow() {
        Map<String, Object> later = event("elpais:1");
        later.put("risk_label", "Medium-Operational");

        sink.insertRows("analytics_events", List.of(event("elpais:1"), later));

        assertThat(jdbcTemplate.queryForList(
                "SELECT risk_label FROM analytics_events WHERE event_id = 'elpais:1'", String.class))
                .containsExactly("Medium-Operational");
    }

    @Test
    void failedBatchKeepsPreviouslyStoredRows() {
        sink.insertRows("analytics_events", List.of(event("elpais:1")));

        Map<String, Object> broken = event("elpais:1");
        broken.remove("title");
        assertThatThrownBy(() -> sink.insertRows("analytics_events", List.of(broken)))
                .isInstanceOf(RuntimeException.class);

        assertThat(jdbcTemplate.queryForObject(
                "SELECT title FROM analytics_events WHERE event_id = 'elpais:1'", String.class))
                .isEqualTo("Multa de la CNMV");
    }

    @Test
    void emptyBatchIsNoOp() {
        assertThat(sink.insertRows("analytics_events", List.of())).isEmpty();
    }

    @Test
    void unknownTableFails() {
        assertThatThrownBy(() -> sink.insertRows("no_such_table", List.of(event("x:1"))))
                .isInstanceOf(RuntimeException.class);
    }

    private static Map<String, Object> event(String eventId) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event_id", eventId);
        row.put("raw_id", "abc");
        row.put("title", "Multa de la CNMV");
        row.put("source", "elpais");
        row.put("risk_label", "High-Legal");
        row.put("confidence", 0.9);
        row.put("alerted", true);
        row.put("created_at", Timestamp.from(Instant.parse("2024-03-15T10:00:00Z")));
        return row;
    }
}
