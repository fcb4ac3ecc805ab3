package org.iceforge.tabula.function.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.iceforge.tabula.function.warehouse.BigQueryWarehouseClient;
import org.iceforge.tabula.function.warehouse.UnconfiguredWarehouseClient;
import org.iceforge.tabula.function.warehouse.WarehouseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single process-wide warehouse client. It is created once at startup and shared by all requests.
 */
@Configuration
@EnableConfigurationProperties(WarehouseProperties.class)
public class WarehouseClientConfig {
    private static final Logger log = LoggerFactory.getLogger(WarehouseClientConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "tabula.warehouse", name = "enabled", havingValue = "true")
    public BigQuery bigQuery(WarehouseProperties props) {
        BigQueryOptions.Builder options = BigQueryOptions.newBuilder();
        if (props.projectId() != null && !props.projectId().isBlank()) {
            options.setProjectId(props.projectId());
        }
        if (props.location() != null && !props.location().isBlank()) {
            options.setLocation(props.location());
        }
        BigQuery service = options.build().getService();
        // Credentials come from the runtime's application-default chain; never log them.
        log.info("BigQuery client ready for project='{}' location='{}'",
                service.getOptions().getProjectId(), props.location());
        return service;
    }

    @Bean
    @ConditionalOnProperty(prefix = "tabula.warehouse", name = "enabled", havingValue = "true")
    public WarehouseClient bigQueryWarehouseClient(BigQuery bigQuery, WarehouseProperties props) {
        return new BigQueryWarehouseClient(bigQuery, props.jobTimeout(), props.labels());
    }

    @Bean
    @ConditionalOnProperty(prefix = "tabula.warehouse", name = "enabled", havingValue = "false", matchIfMissing = true)
    public WarehouseClient unconfiguredWarehouseClient() {
        log.warn("tabula.warehouse.enabled is not true; queries will fail until a warehouse is configured");
        return new UnconfiguredWarehouseClient();
    }
}
