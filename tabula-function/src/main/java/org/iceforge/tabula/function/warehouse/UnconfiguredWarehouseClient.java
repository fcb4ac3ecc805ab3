package org.iceforge.tabula.function.warehouse;

import org.iceforge.tabula.core.query.QueryModels;

import java.util.List;
import java.util.Map;

/**
 * Stand-in used when {@code tabula.warehouse.enabled=false}: every call fails, so requests still validate
 * but end in a 500.
 */
public final class UnconfiguredWarehouseClient implements WarehouseClient {

    @Override
    public List<Map<String, Object>> execute(String sql, List<QueryModels.BoundParameter> parameters) {
        throw new WarehouseException("warehouse is not configured (set tabula.warehouse.enabled=true)");
    }
}
