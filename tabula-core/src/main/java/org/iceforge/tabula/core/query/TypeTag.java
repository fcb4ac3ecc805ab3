package org.iceforge.tabula.core.query;

/**
 * Scalar parameter types understood by the warehouse.
 */
public enum TypeTag {
    STRING,
    BOOL,
    INT64,
    FLOAT64;

    /**
     * Picks the tag for a scalar Java value.
     * <p>
     * Booleans are checked before integers; everything that is neither boolean, integral nor floating
     * point is bound as {@link #STRING}.
     */
    public static TypeTag classify(Object value) {
        if (value instanceof Boolean) return BOOL;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return INT64;
        }
        if (value instanceof Double || value instanceof Float) return FLOAT64;
        return STRING;
    }
}
