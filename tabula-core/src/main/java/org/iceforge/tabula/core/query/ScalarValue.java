package org.iceforge.tabula.core.query;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Filter value: one of the four scalar kinds a parameter can be bound as.
 */
public sealed interface ScalarValue
        permits ScalarValue.StringValue, ScalarValue.BoolValue, ScalarValue.Int64Value, ScalarValue.Float64Value {

    /** Plain Java value handed to the warehouse binding. */
    Object raw();

    default TypeTag typeTag() {
        return TypeTag.classify(raw());
    }

    /**
     * Reads a scalar out of a JSON node. Booleans are matched first, then integers that fit in 64 bits,
     * then floating point numbers, then text. Anything else (null, arrays, objects, huge integers) is empty.
     */
    static Optional<ScalarValue> fromJson(JsonNode node) {
        if (node == null) return Optional.empty();
        if (node.isBoolean()) return Optional.of(new BoolValue(node.booleanValue()));
        if (node.isIntegralNumber()) {
            return node.canConvertToLong()
                    ? Optional.of(new Int64Value(node.longValue()))
                    : Optional.empty();
        }
        if (node.isFloatingPointNumber()) return Optional.of(new Float64Value(node.doubleValue()));
        if (node.isTextual()) return Optional.of(new StringValue(node.textValue()));
        return Optional.empty();
    }

    record StringValue(String value) implements ScalarValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record BoolValue(boolean value) implements ScalarValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record Int64Value(long value) implements ScalarValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record Float64Value(double value) implements ScalarValue {
        @Override
        public Object raw() {
            return value;
        }
    }
}
