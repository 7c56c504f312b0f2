package org.iceforge.saga.analytics.service;

/**
 * Malformed filter or empty question. Raised before any external call is made.
 */
public class AnalyticsValidationException extends RuntimeException {
    public AnalyticsValidationException(String message) {
        super(message);
    }
}
