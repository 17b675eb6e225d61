package io.riskwatch.ingestion.api.service.sink;

import io.riskwatch.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Batch insert through {@link SimpleJdbcInsert}. Tables with a key column are written as upserts:
 * rows already stored under the same key are replaced in the same transaction, so a re-queued row
 * overwrites instead of duplicating.
 */
@Component
public class JdbcAnalyticalSink implements AnalyticalSink {

    private static final Logger logger = LoggerFactory.getLogger(JdbcAnalyticalSink.class);

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Map<String, String> keyColumns;
    private final Map<String, SimpleJdbcInsert> inserts = new ConcurrentHashMap<>();

    @Autowired
    public JdbcAnalyticalSink(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                              IngestionConfig config) {
        this(jdbcTemplate, transactionManager, Map.of(
                config.writer().eventsTable(), "event_id",
                config.writer().runsTable(), "run_id"));
    }

    public JdbcAnalyticalSink(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                              Map<String, String> keyColumns) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.keyColumns = Map.copyOf(keyColumns);
    }

    @Override
    public List<String> insertRows(String table, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return List.of();

        String keyColumn = keyColumns.get(table);
        List<Map<String, Object>> batch = keyColumn == null ? rows : lastPerKey(rows, keyColumn);

        int[] counts = transactionTemplate.execute(status -> {
            if (keyColumn != null) {
                List<Object> keys = batch.stream().map(row -> row.get(keyColumn)).toList();
                int replaced = namedJdbcTemplate.update(
                        "DELETE FROM " + table + " WHERE " + keyColumn + " IN (:keys)", Map.of("keys", keys));
                if (replaced > 0) {
                    logger.info("Replacing {} existing rows in {}", replaced, table);
                }
            }
            return inserts.computeIfAbsent(table, name -> new SimpleJdbcInsert(jdbcTemplate).withTableName(name))
                    .executeBatch(batch.stream()
                            .map(MapSqlParameterSource::new)
                            .toArray(SqlParameterSource[]::new));
        });

        List<String> errors = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == 0) {
                errors.add("row " + i + " rejected by " + table);
            }
        }
        logger.debug("Inserted {} rows into {} ({} rejected)", batch.size(), table, errors.size());
        return errors;
    }

    // a key repeated inside one batch keeps its latest row
    private static List<Map<String, Object>> lastPerKey(List<Map<String, Object>> rows, String keyColumn) {
        Map<Object, Map<String, Object>> byKey = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object key = row.get(keyColumn);
            if (key == null) {
                throw new IllegalArgumentException("Row without " + keyColumn);
            }
            byKey.remove(key);
            byKey.put(key, row);
        }
        return new ArrayList<>(byKey.values());
    }
}
