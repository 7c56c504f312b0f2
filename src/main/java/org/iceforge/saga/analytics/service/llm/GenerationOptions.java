package org.iceforge.saga.analytics.service.llm;

/**
 * Sampling settings for one completion. A null {@code maxTokens} leaves the limit to the provider.
 */
public record GenerationOptions(double temperature, Integer maxTokens) {

    public static GenerationOptions of(double temperature, int maxTokens) {
        return new GenerationOptions(temperature, maxTokens);
    }
}
