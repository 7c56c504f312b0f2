package org.iceforge.saga.analytics.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final boolean success = false;
    private final Instant timestamp = Instant.now();
    private final String code;
    private final String error;
    private final String raw;

    public ErrorResponse(String code, String error) {
        this(code, error, null);
    }

    public ErrorResponse(String code, String error, String raw) {
        this.code = code;
        this.error = error;
        this.raw = raw;
    }

    public boolean isSuccess() {
        return success;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getCode() {
        return code;
    }

    public String getError() {
        return error;
    }

    /**
     * Excerpt of an unusable model response, when that is what failed.
     */
    public String getRaw() {
        return raw;
    }
}
