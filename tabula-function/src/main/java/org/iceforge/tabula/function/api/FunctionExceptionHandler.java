package org.iceforge.tabula.function.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Last line of defence: anything that escapes the pipeline still gets the JSON envelope, without a stack trace.
 */
@RestControllerAdvice(assignableTypes = QueryFunctionController.class)
public class FunctionExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(FunctionExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<FunctionResponse> unexpected(Exception e) {
        log.error("Unhandled error in query function: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(FunctionResponse.failed("Internal error: " + e.getClass().getSimpleName()));
    }
}
