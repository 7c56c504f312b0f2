package org.iceforge.saga.analytics.service;

/**
 * The text-generation capability failed or returned a structure that could not be parsed.
 * Carries an excerpt of the raw response when there was one.
 */
public class GenerationException extends RuntimeException {

    private final String rawExcerpt;

    public GenerationException(String message, String rawExcerpt) {
        super(message);
        this.rawExcerpt = rawExcerpt;
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
        this.rawExcerpt = null;
    }

    public String getRawExcerpt() {
        return rawExcerpt;
    }
}
