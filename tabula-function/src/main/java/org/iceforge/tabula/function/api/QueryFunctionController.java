package org.iceforge.tabula.function.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.iceforge.tabula.core.query.ErrorKind;
import org.iceforge.tabula.core.query.QueryError;
import org.iceforge.tabula.function.query.TableQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

/**
 * The query function. Served on every path, as on a function runtime where the URL is the function.
 * <p>
 * Preflight {@code OPTIONS} never reaches this controller; see {@link CorsHeadersFilter}.
 */
@RestController
public class QueryFunctionController {
    private static final Logger log = LoggerFactory.getLogger(QueryFunctionController.class);

    private static final QueryError INVALID_JSON = new QueryError(ErrorKind.MALFORMED_JSON, "Invalid JSON payload.");
    private static final QueryError WRONG_METHOD =
            new QueryError(ErrorKind.METHOD_NOT_ALLOWED, "Method not allowed. Use POST.");

    private final TableQueryService queryService;
    private final ObjectReader jsonReader;

    public QueryFunctionController(TableQueryService queryService, ObjectMapper objectMapper) {
        this.queryService = Objects.requireNonNull(queryService);
        // The whole body must be one JSON value; "{...} trailing text" is malformed.
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @PostMapping("/**")
    public ResponseEntity<FunctionResponse> query(@RequestBody(required = false) String body) {
        if (body == null || body.isBlank()) {
            return ResponseFormatter.failure(INVALID_JSON);
        }
        JsonNode json;
        try {
            json = jsonReader.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable request body: {}", e.getOriginalMessage());
            return ResponseFormatter.failure(INVALID_JSON);
        }
        return ResponseFormatter.format(queryService.run(json));
    }

    @RequestMapping("/**")
    public ResponseEntity<FunctionResponse> otherMethods() {
        return ResponseFormatter.failure(WRONG_METHOD);
    }
}
