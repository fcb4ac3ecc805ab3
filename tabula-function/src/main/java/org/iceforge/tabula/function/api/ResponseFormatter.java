package org.iceforge.tabula.function.api;

import org.iceforge.tabula.core.query.ErrorKind;
import org.iceforge.tabula.core.query.Outcome;
import org.iceforge.tabula.core.query.QueryError;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

/** Maps pipeline outcomes to HTTP responses. CORS headers are added by {@link CorsHeadersFilter}. */
final class ResponseFormatter {
    private ResponseFormatter() {}

    static ResponseEntity<FunctionResponse> format(Outcome<List<Map<String, Object>>> outcome) {
        if (outcome instanceof Outcome.Success<List<Map<String, Object>>> s) {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(FunctionResponse.ok(s.value()));
        }
        return failure(((Outcome.Failure<List<Map<String, Object>>>) outcome).error());
    }

    static ResponseEntity<FunctionResponse> failure(QueryError error) {
        return ResponseEntity.status(statusFor(error.kind()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(FunctionResponse.failed(error.message()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case METHOD_NOT_ALLOWED -> HttpStatus.METHOD_NOT_ALLOWED;
            case QUERY_EXECUTION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case MISSING_FIELD, INVALID_IDENTIFIER, INVALID_OPERATOR, MISSING_COLUMNS,
                 INVALID_LIMIT, INVALID_FILTER_VALUE, MALFORMED_JSON -> HttpStatus.BAD_REQUEST;
        };
    }
}
