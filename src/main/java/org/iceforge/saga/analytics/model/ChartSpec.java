package org.iceforge.saga.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One chart as requested by the model. {@code chartType} is kept as the model wrote it.
 */
public record ChartSpec(
        String title,
        @JsonProperty("chart_type") String chartType,
        String sql
) {}
