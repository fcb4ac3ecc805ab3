package org.iceforge.tabula.function.query;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.tabula.core.query.Outcome;
import org.iceforge.tabula.core.query.QueryBuilder;
import org.iceforge.tabula.core.query.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validate, build, execute. The first failing step decides the outcome.
 */
@Service
public class TableQueryService {
    private static final Logger log = LoggerFactory.getLogger(TableQueryService.class);

    private final RequestValidator validator;
    private final QueryBuilder builder;
    private final QueryExecutor executor;

    public TableQueryService(RequestValidator validator, QueryBuilder builder, QueryExecutor executor) {
        this.validator = Objects.requireNonNull(validator);
        this.builder = Objects.requireNonNull(builder);
        this.executor = Objects.requireNonNull(executor);
    }

    public Outcome<List<Map<String, Object>>> run(JsonNode body) {
        Outcome<List<Map<String, Object>>> outcome = validator.validate(body)
                .map(builder::build)
                .flatMap(executor::execute);
        if (outcome instanceof Outcome.Failure<List<Map<String, Object>>> f) {
            log.warn("Query request failed: {}", f.error().kind());
        }
        return outcome;
    }
}
