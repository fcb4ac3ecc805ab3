package org.iceforge.tabula.function.config;

import org.iceforge.tabula.core.query.QueryBuilder;
import org.iceforge.tabula.core.query.RequestValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the stateless core components as beans. */
@Configuration
public class QueryPipelineConfig {

    @Bean
    public RequestValidator requestValidator() {
        return new RequestValidator();
    }

    @Bean
    public QueryBuilder queryBuilder() {
        return new QueryBuilder();
    }
}
