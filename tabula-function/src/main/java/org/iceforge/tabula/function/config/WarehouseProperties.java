package org.iceforge.tabula.function.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the BigQuery warehouse.
 *
 * <p>{@code projectId} is the job/billing project, not the project being queried; tables in other projects
 * are addressed by the request. When blank the client library's default project detection applies.
 */
@ConfigurationProperties(prefix = "tabula.warehouse")
public record WarehouseProperties(
        boolean enabled,
        String projectId,
        String location,
        Duration jobTimeout,
        Map<String, String> labels
) {
}
