package org.iceforge.saga.analytics.service;

/**
 * A required external capability is not configured. Not retried.
 */
public class CapabilityUnavailableException extends RuntimeException {
    public CapabilityUnavailableException(String message) {
        super(message);
    }
}
