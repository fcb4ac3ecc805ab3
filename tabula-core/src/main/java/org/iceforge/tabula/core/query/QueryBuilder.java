package org.iceforge.tabula.core.query;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a validated request into parameterized standard SQL.
 * <p>
 * Only identifiers (after {@link Identifiers#isValid(String)}) and operator tokens from {@link FilterOperator}
 * become SQL text. Every filter value is bound as a named parameter.
 */
public final class QueryBuilder {

    public QueryModels.BuiltQuery build(QueryModels.QueryRequest request) {
        StringJoiner select = new StringJoiner(", ");
        for (String column : request.columns()) {
            select.add(Identifiers.quote(column));
        }

        StringBuilder sql = new StringBuilder(64)
                .append("SELECT ").append(select)
                .append(" FROM ").append(tableRef(request));

        List<QueryModels.BoundParameter> params = new ArrayList<>();
        StringJoiner where = new StringJoiner(" AND ");
        List<QueryModels.FilterClause> filters = request.filters();
        for (int i = 0; i < filters.size(); i++) {
            where.add(clause(i, filters.get(i), params));
        }
        if (!filters.isEmpty()) {
            sql.append(" WHERE ").append(where);
        }

        sql.append(" LIMIT ").append(request.limit());
        return new QueryModels.BuiltQuery(sql.toString(), params);
    }

    private static String tableRef(QueryModels.QueryRequest request) {
        // Validate each part separately; the dots are only added here.
        Identifiers.quote(request.projectId());
        Identifiers.quote(request.datasetId());
        Identifiers.quote(request.tableId());
        return "`" + request.projectId() + "." + request.datasetId() + "." + request.tableId() + "`";
    }

    private static String clause(int index, QueryModels.FilterClause filter, List<QueryModels.BoundParameter> params) {
        String lhs = Identifiers.quote(filter.column()) + " " + filter.operator().token();

        if (!filter.operator().isList()) {
            String name = "param_" + index;
            ScalarValue value = filter.value();
            params.add(new QueryModels.BoundParameter(name, value.typeTag(), value.raw()));
            return lhs + " @" + name;
        }

        // List members are always bound as STRING; the warehouse decides whether to coerce them.
        String csv = String.valueOf(filter.value().raw());
        String[] members = csv.split(",", -1);
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        for (int j = 0; j < members.length; j++) {
            String name = "param_" + index + "_" + j;
            placeholders.add("@" + name);
            params.add(new QueryModels.BoundParameter(name, TypeTag.STRING, members[j].trim()));
        }
        return lhs + " " + placeholders;
    }
}
