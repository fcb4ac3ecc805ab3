package org.iceforge.tabula.core.query;

/**
 * Classification of every way a query request can fail.
 */
public enum ErrorKind {
    MISSING_FIELD,
    INVALID_IDENTIFIER,
    INVALID_OPERATOR,
    MISSING_COLUMNS,
    INVALID_LIMIT,
    INVALID_FILTER_VALUE,
    MALFORMED_JSON,
    METHOD_NOT_ALLOWED,
    QUERY_EXECUTION_FAILED
}
