package org.iceforge.saga.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record VisualizationTrace(
        @JsonProperty("user_message") String userInputQuestion,
        @JsonProperty("queries_text") String queries,
        @JsonProperty("created_at") LocalDateTime createdAt
) {}
