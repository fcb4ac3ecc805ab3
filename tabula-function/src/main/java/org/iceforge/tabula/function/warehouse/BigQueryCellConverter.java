package org.iceforge.tabula.function.warehouse;

import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.StandardSQLTypeName;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Maps BigQuery result cells to plain Java values that Jackson can serialize. */
final class BigQueryCellConverter {
    private BigQueryCellConverter() {}

    static Map<String, Object> toRow(FieldList fields, FieldValueList values) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            row.put(field.getName(), toJava(field, values.get(i)));
        }
        return row;
    }

    static Object toJava(Field field, FieldValue value) {
        if (value == null || value.isNull()) return null;

        if (field.getMode() == Field.Mode.REPEATED) {
            Field element = field.toBuilder().setMode(Field.Mode.NULLABLE).build();
            List<Object> out = new ArrayList<>();
            for (FieldValue v : value.getRepeatedValue()) {
                out.add(toJava(element, v));
            }
            return out;
        }

        StandardSQLTypeName type = field.getType().getStandardType();
        return switch (type) {
            case BOOL -> value.getBooleanValue();
            case INT64 -> value.getLongValue();
            case FLOAT64 -> value.getDoubleValue();
            case NUMERIC, BIGNUMERIC -> value.getNumericValue();
            // Microseconds since epoch.
            case TIMESTAMP -> Instant.EPOCH.plus(value.getTimestampValue(), ChronoUnit.MICROS).toString();
            case STRUCT -> toRow(field.getSubFields(), value.getRecordValue());
            default -> value.getStringValue();
        };
    }
}
