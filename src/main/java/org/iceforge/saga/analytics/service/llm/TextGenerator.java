package org.iceforge.saga.analytics.service.llm;

import java.util.List;

/**
 * A chat-style text generation capability.
 */
public interface TextGenerator {

    /**
     * @return the generated text, never null
     * @throws org.iceforge.saga.analytics.service.CapabilityUnavailableException when generation is not configured
     * @throws org.iceforge.saga.analytics.service.GenerationException when the call fails or returns nothing usable
     */
    String complete(List<ChatMessage> messages, GenerationOptions options);
}
