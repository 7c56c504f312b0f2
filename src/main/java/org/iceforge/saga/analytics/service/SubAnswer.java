package org.iceforge.saga.analytics.service;

public record SubAnswer(String text, boolean success) {

    public static SubAnswer ok(String text) {
        return new SubAnswer(text, true);
    }

    public static SubAnswer error(String message) {
        return new SubAnswer(message, false);
    }
}
