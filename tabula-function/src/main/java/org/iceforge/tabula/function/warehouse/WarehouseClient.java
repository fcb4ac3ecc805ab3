package org.iceforge.tabula.function.warehouse;

import org.iceforge.tabula.core.query.QueryModels;

import java.util.List;
import java.util.Map;

/**
 * Outbound seam to the managed query service.
 * <p>
 * Implementations are shared singletons and must tolerate concurrent calls.
 */
public interface WarehouseClient {

    /**
     * Runs {@code sql} with the given named parameters, blocks until the job finishes and returns every row.
     *
     * @throws WarehouseException on any warehouse-side failure
     */
    List<Map<String, Object>> execute(String sql, List<QueryModels.BoundParameter> parameters);
}
