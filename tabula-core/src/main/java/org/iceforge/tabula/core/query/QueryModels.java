package org.iceforge.tabula.core.query;

import java.util.List;
import java.util.Objects;

/**
 * Immutable models passed from the validator to the builder and on to the executor.
 */
public final class QueryModels {
    public static final int DEFAULT_LIMIT = 1000;
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 5000;

    private QueryModels() {}

    /**
     * A validated table query. Every identifier has passed {@link Identifiers#isValid(String)}.
     */
    public record QueryRequest(
            String projectId,
            String datasetId,
            String tableId,
            List<String> columns,
            List<FilterClause> filters,
            int limit
    ) {
        public QueryRequest {
            Objects.requireNonNull(projectId, "projectId");
            Objects.requireNonNull(datasetId, "datasetId");
            Objects.requireNonNull(tableId, "tableId");
            columns = List.copyOf(columns);
            filters = filters == null ? List.of() : List.copyOf(filters);
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("columns must not be empty");
            }
            if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit out of range: " + limit);
            }
        }
    }

    public record FilterClause(
            String column,
            FilterOperator operator,
            ScalarValue value
    ) {
        public FilterClause {
            Objects.requireNonNull(column, "column");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(value, "value");
        }
    }

    /** Named, typed placeholder value. {@code name} is referenced in SQL as {@code @name}. */
    public record BoundParameter(
            String name,
            TypeTag type,
            Object value
    ) {
        public BoundParameter {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    public record BuiltQuery(
            String sql,
            List<BoundParameter> parameters
    ) {
        public BuiltQuery {
            Objects.requireNonNull(sql, "sql");
            parameters = List.copyOf(parameters);
        }
    }
}
