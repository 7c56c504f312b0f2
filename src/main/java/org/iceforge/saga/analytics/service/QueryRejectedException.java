package org.iceforge.saga.analytics.service;

/**
 * Generated query text failed the read-only check and was not executed.
 */
public class QueryRejectedException extends RuntimeException {

    public QueryRejectedException(String message) {
        super(message);
    }
}
