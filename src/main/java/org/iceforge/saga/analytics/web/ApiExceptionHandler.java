package org.iceforge.saga.analytics.web;

import org.iceforge.saga.analytics.service.AnalyticsValidationException;
import org.iceforge.saga.analytics.service.CapabilityUnavailableException;
import org.iceforge.saga.analytics.service.GenerationException;
import org.iceforge.saga.analytics.service.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Maps failures from every controller to {@link ErrorResponse}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AnalyticsValidationException.class)
    public ResponseEntity<ErrorResponse> badRequest(AnalyticsValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse("VALIDATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> invalidBinding(WebExchangeBindException e) {
        String detail = e.getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST,
                new ErrorResponse("VALIDATION_ERROR", detail.isEmpty() ? e.getReason() : detail));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> unreadableInput(ServerWebInputException e) {
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse("VALIDATION_ERROR", e.getReason()));
    }

    @ExceptionHandler(CapabilityUnavailableException.class)
    public ResponseEntity<ErrorResponse> unavailable(CapabilityUnavailableException e) {
        log.warn("Request needs an unconfigured capability: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, new ErrorResponse("CONFIGURATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorResponse> generationFailed(GenerationException e) {
        log.error("Text generation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, new ErrorResponse("GENERATION_ERROR", e.getMessage(), e.getRawExcerpt()));
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> queryFailed(QueryExecutionException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new ErrorResponse("QUERY_ERROR", e.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> statusError(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;
        String code = status == HttpStatus.NOT_FOUND ? "NOT_FOUND"
                : status.is4xxClientError() ? "VALIDATION_ERROR" : "SERVER_ERROR";
        return respond(status, new ErrorResponse(code, e.getReason() != null ? e.getReason() : status.getReasonPhrase()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> serverError(RuntimeException e) {
        log.error("Unhandled request failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new ErrorResponse("SERVER_ERROR", e.getMessage()));
    }

    private static String describe(FieldError fe) {
        return fe.getField() + ": " + fe.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
