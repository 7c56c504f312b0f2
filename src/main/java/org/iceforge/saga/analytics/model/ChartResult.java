package org.iceforge.saga.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A rendered chart, or the reason one chart could not be produced ({@code chart_type = "error"}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChartResult(
        String title,
        @JsonProperty("chart_type") String chartType,
        String xKey,
        String yKey,
        List<Map<String, Object>> data,
        String error
) {
    public static final String ERROR_TYPE = "error";

    public static ChartResult ok(String title, ChartType type, String xKey, String yKey, List<Map<String, Object>> data) {
        return new ChartResult(title, type.code(), xKey, yKey, data, null);
    }

    public static ChartResult error(String title, String message) {
        return new ChartResult(title, ERROR_TYPE, null, null, null, message);
    }

    public boolean failed() {
        return ERROR_TYPE.equals(chartType);
    }
}
