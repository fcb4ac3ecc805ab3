package org.iceforge.tabula.function.query;

import org.iceforge.tabula.core.query.ErrorKind;
import org.iceforge.tabula.core.query.Outcome;
import org.iceforge.tabula.core.query.QueryModels;
import org.iceforge.tabula.function.warehouse.WarehouseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Submits a built query to the warehouse once and reports the materialized rows, or a
 * {@link ErrorKind#QUERY_EXECUTION_FAILED} carrying the warehouse's message. No retries.
 */
@Component
public class QueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    static final String FAILURE_PREFIX = "BigQuery query failed: ";

    private final WarehouseClient warehouse;

    public QueryExecutor(WarehouseClient warehouse) {
        this.warehouse = Objects.requireNonNull(warehouse, "warehouse");
    }

    public Outcome<List<Map<String, Object>>> execute(QueryModels.BuiltQuery query) {
        Instant start = Instant.now();
        // Parameter values stay out of the log; the SQL text only holds identifiers and placeholders.
        log.info("Executing query: {} ({} bound parameters)", query.sql(), query.parameters().size());
        try {
            List<Map<String, Object>> rows = warehouse.execute(query.sql(), query.parameters());
            log.info("Query returned {} rows in {} ms", rows.size(), Duration.between(start, Instant.now()).toMillis());
            return Outcome.success(rows);
        } catch (Exception e) {
            log.error("Query failed after {} ms: {}", Duration.between(start, Instant.now()).toMillis(), e.getMessage(), e);
            return Outcome.failure(ErrorKind.QUERY_EXECUTION_FAILED, FAILURE_PREFIX + e.getMessage());
        }
    }
}
