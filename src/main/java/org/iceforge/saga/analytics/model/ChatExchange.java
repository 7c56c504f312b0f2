package org.iceforge.saga.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record ChatExchange(
        @JsonProperty("user_message") String userMessage,
        @JsonProperty("assistant_response") String assistantResponse,
        @JsonProperty("created_at") LocalDateTime createdAt
) {

    public static ChatExchange of(String userMessage, String assistantResponse) {
        return new ChatExchange(userMessage, assistantResponse, null);
    }
}
