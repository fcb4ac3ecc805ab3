package org.iceforge.tabula.core.query;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw JSON request body into a {@link QueryModels.QueryRequest}, or a classified {@link QueryError}.
 * <p>
 * Pure and stateless; one instance may be shared across threads. Malformed input never throws.
 */
public final class RequestValidator {

    public Outcome<QueryModels.QueryRequest> validate(JsonNode body) {
        if (body == null || !body.isObject() || body.isEmpty()) {
            return Outcome.failure(ErrorKind.MALFORMED_JSON, "Invalid JSON payload.");
        }

        return requiredIdentifier(body, "projectId").flatMap(projectId ->
                requiredIdentifier(body, "datasetId").flatMap(datasetId ->
                        requiredIdentifier(body, "tableId").flatMap(tableId ->
                                columns(body.get("columns")).flatMap(columns ->
                                        filters(body.get("filters")).flatMap(filters ->
                                                limit(body.get("limit")).map(limit ->
                                                        new QueryModels.QueryRequest(
                                                                projectId, datasetId, tableId, columns, filters, limit)))))));
    }

    private static Outcome<String> requiredIdentifier(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isTextual()) {
            return Outcome.failure(ErrorKind.MISSING_FIELD, "Missing or non-string field: " + field);
        }
        return identifier(field, node.textValue());
    }

    private static Outcome<String> identifier(String field, String value) {
        if (!Identifiers.isValid(value)) {
            return Outcome.failure(ErrorKind.INVALID_IDENTIFIER, "Invalid identifier for " + field + ": " + value);
        }
        return Outcome.success(value);
    }

    private static Outcome<List<String>> columns(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return Outcome.failure(ErrorKind.MISSING_COLUMNS, "At least one column must be selected.");
        }
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode col : node) {
            if (!col.isTextual()) {
                return Outcome.failure(ErrorKind.INVALID_IDENTIFIER, "Invalid identifier for columns: " + col);
            }
            Outcome<String> checked = identifier("columns", col.textValue());
            if (checked instanceof Outcome.Failure<String> f) {
                return Outcome.failure(f.error());
            }
            out.add(col.textValue());
        }
        return Outcome.success(out);
    }

    private static Outcome<List<QueryModels.FilterClause>> filters(JsonNode node) {
        if (node == null || node.isNull()) {
            return Outcome.success(List.of());
        }
        if (!node.isArray()) {
            return Outcome.failure(ErrorKind.INVALID_FILTER_VALUE, "filters must be an array.");
        }
        List<QueryModels.FilterClause> out = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            Outcome<QueryModels.FilterClause> clause = filter(i, node.get(i));
            if (clause instanceof Outcome.Failure<QueryModels.FilterClause> f) {
                return Outcome.failure(f.error());
            }
            out.add(((Outcome.Success<QueryModels.FilterClause>) clause).value());
        }
        return Outcome.success(out);
    }

    private static Outcome<QueryModels.FilterClause> filter(int index, JsonNode node) {
        String where = "filters[" + index + "]";
        if (node == null || !node.isObject()) {
            return Outcome.failure(ErrorKind.INVALID_FILTER_VALUE, where + " must be an object.");
        }

        JsonNode column = node.get("column");
        if (column == null || column.isNull()) {
            return Outcome.failure(ErrorKind.MISSING_FIELD, "Missing field: " + where + ".column");
        }
        if (!column.isTextual() || !Identifiers.isValid(column.textValue())) {
            return Outcome.failure(ErrorKind.INVALID_IDENTIFIER, "Invalid identifier for " + where + ".column: " + column.asText());
        }

        JsonNode operator = node.get("operator");
        if (operator == null || operator.isNull()) {
            return Outcome.failure(ErrorKind.MISSING_FIELD, "Missing field: " + where + ".operator");
        }
        Optional<FilterOperator> op = operator.isTextual() ? FilterOperator.parse(operator.textValue()) : Optional.empty();
        if (op.isEmpty()) {
            return Outcome.failure(ErrorKind.INVALID_OPERATOR, "Invalid operator for " + where + ": " + operator.asText());
        }

        JsonNode value = node.get("value");
        if (value == null) {
            return Outcome.failure(ErrorKind.MISSING_FIELD, "Missing field: " + where + ".value");
        }
        if (op.get().isList() && !value.isTextual()) {
            return Outcome.failure(ErrorKind.INVALID_FILTER_VALUE,
                    "Value for IN/NOT IN operator must be a comma-separated string (" + where + ").");
        }
        Optional<ScalarValue> scalar = ScalarValue.fromJson(value);
        if (scalar.isEmpty()) {
            return Outcome.failure(ErrorKind.INVALID_FILTER_VALUE,
                    "Value for " + where + " must be a string, boolean, integer or float.");
        }
        return Outcome.success(new QueryModels.FilterClause(column.textValue(), op.get(), scalar.get()));
    }

    private static Outcome<Integer> limit(JsonNode node) {
        if (node == null) {
            return Outcome.success(QueryModels.DEFAULT_LIMIT);
        }
        Optional<Long> parsed = integral(node);
        if (parsed.isEmpty() || parsed.get() < QueryModels.MIN_LIMIT || parsed.get() > QueryModels.MAX_LIMIT) {
            return Outcome.failure(ErrorKind.INVALID_LIMIT,
                    "Limit must be between " + QueryModels.MIN_LIMIT + " and " + QueryModels.MAX_LIMIT + ".");
        }
        return Outcome.success(parsed.get().intValue());
    }

    private static Optional<Long> integral(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? Optional.of(node.longValue()) : Optional.empty();
        }
        if (node.isFloatingPointNumber()) {
            BigDecimal d = node.decimalValue();
            if (d.stripTrailingZeros().scale() > 0) return Optional.empty();
            try {
                return Optional.of(d.longValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        if (node.isTextual()) {
            try {
                return Optional.of(Long.parseLong(node.textValue().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
