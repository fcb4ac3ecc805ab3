package org.iceforge.tabula.function.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Uniform envelope: {@code {"success":true,"data":[...]}} or {@code {"success":false,"error":"..."}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionResponse(
        boolean success,
        List<Map<String, Object>> data,
        String error
) {
    public static FunctionResponse ok(List<Map<String, Object>> data) {
        return new FunctionResponse(true, data, null);
    }

    public static FunctionResponse failed(String error) {
        return new FunctionResponse(false, null, error);
    }
}
