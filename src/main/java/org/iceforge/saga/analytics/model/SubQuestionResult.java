package org.iceforge.saga.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SubQuestionResult(
        @JsonProperty("question_number") int questionNumber,
        String question,
        String result,
        String status
) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
