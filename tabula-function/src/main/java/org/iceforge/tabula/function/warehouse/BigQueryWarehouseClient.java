package org.iceforge.tabula.function.warehouse;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.TableResult;
import org.iceforge.tabula.core.query.QueryModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes standard-SQL queries against BigQuery with named parameters.
 *
 * <p>Blocks on the job and materializes the whole result set; there is no paging back to the caller.
 */
public class BigQueryWarehouseClient implements WarehouseClient {
    private static final Logger log = LoggerFactory.getLogger(BigQueryWarehouseClient.class);

    private final BigQuery bigQuery;
    private final Duration jobTimeout;
    private final Map<String, String> labels;

    public BigQueryWarehouseClient(BigQuery bigQuery) {
        this(bigQuery, null, Map.of());
    }

    public BigQueryWarehouseClient(BigQuery bigQuery, Duration jobTimeout, Map<String, String> labels) {
        this.bigQuery = Objects.requireNonNull(bigQuery, "bigQuery");
        this.jobTimeout = jobTimeout;
        this.labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    @Override
    public List<Map<String, Object>> execute(String sql, List<QueryModels.BoundParameter> parameters) {
        Objects.requireNonNull(sql, "sql");
        QueryJobConfiguration config = jobConfig(sql, parameters);

        List<Map<String, Object>> rows = new ArrayList<>();
        try {
            TableResult result = bigQuery.query(config);
            FieldList fields = result.getSchema() == null ? FieldList.of() : result.getSchema().getFields();
            // iterateAll() fetches further pages lazily and can fail mid-way.
            for (FieldValueList values : result.iterateAll()) {
                rows.add(BigQueryCellConverter.toRow(fields, values));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WarehouseException("interrupted while waiting for query job", e);
        } catch (RuntimeException e) {
            // BigQueryException, JobException and friends: keep the service's own message for the caller.
            throw new WarehouseException(Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName()), e);
        }
        log.debug("BigQuery job returned {} rows", rows.size());
        return rows;
    }

    QueryJobConfiguration jobConfig(String sql, List<QueryModels.BoundParameter> parameters) {
        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false);
        if (parameters != null) {
            for (QueryModels.BoundParameter p : parameters) {
                builder.addNamedParameter(p.name(), toParameterValue(p));
            }
        }
        if (jobTimeout != null) {
            builder.setJobTimeoutMs(jobTimeout.toMillis());
        }
        if (!labels.isEmpty()) {
            builder.setLabels(labels);
        }
        return builder.build();
    }

    static QueryParameterValue toParameterValue(QueryModels.BoundParameter p) {
        Object v = p.value();
        return switch (p.type()) {
            case BOOL -> QueryParameterValue.bool((Boolean) v);
            case INT64 -> QueryParameterValue.int64(((Number) v).longValue());
            case FLOAT64 -> QueryParameterValue.float64(((Number) v).doubleValue());
            case STRING -> QueryParameterValue.string(v == null ? null : v.toString());
        };
    }
}
