package org.iceforge.saga.analytics.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.iceforge.saga.analytics.model.ChartResult;

import java.time.Instant;
import java.util.List;

public record VisualizationResponse(
        boolean success,
        List<ChartResult> charts,
        @JsonProperty("questions_text") String questionsText,
        Instant timestamp
) {}
