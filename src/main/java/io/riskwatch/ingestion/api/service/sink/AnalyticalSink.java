package io.riskwatch.ingestion.api.service.sink;

import java.util.List;
import java.util.Map;

/**
 * Row-oriented destination of the write-behind buffer.
 */
public interface AnalyticalSink {

    /**
     * Inserts the rows in order. Transport failures are thrown.
     *
     * @return one message per rejected row; empty when every row was accepted
     */
    List<String> insertRows(String table, List<Map<String, Object>> rows);
}
