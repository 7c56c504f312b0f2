package org.iceforge.saga.analytics.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public class QuestionRequest {

    @NotBlank(message = "user_message must not be blank")
    @JsonProperty("user_message")
    private String userMessage;

    public String getUserMessage() {
        return userMessage;
    }

    public void setUserMessage(String userMessage) {
        this.userMessage = userMessage;
    }
}
