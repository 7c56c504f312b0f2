package org.iceforge.saga.analytics.service.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.service.CapabilityUnavailableException;
import org.iceforge.saga.analytics.service.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Objects;

/**
 * Client for an OpenAI-compatible chat completions endpoint.
 * Blocks the calling thread; callers run it off the event loop.
 */
@Component
public class ChatCompletionClient implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionClient.class);

    private final WebClient webClient;
    private final SagaProperties.Llm props;

    public ChatCompletionClient(@Qualifier("llmWebClient") WebClient llmWebClient, SagaProperties props) {
        this.webClient = Objects.requireNonNull(llmWebClient);
        this.props = Objects.requireNonNull(props.getLlm());
    }

    @Override
    public String complete(List<ChatMessage> messages, GenerationOptions options) {
        if (!StringUtils.hasText(props.getApiKey())) {
            throw new CapabilityUnavailableException("Text generation is not configured: set OPENAI_API_KEY");
        }

        CompletionRequest body = new CompletionRequest(
                props.getModel(), messages, options.temperature(), options.maxTokens());
        long started = System.nanoTime();

        JsonNode resp;
        try {
            resp = webClient.post()
                    .uri(props.getChatPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new GenerationException("Text generation failed: HTTP " + e.getStatusCode().value(),
                    abbreviate(e.getResponseBodyAsString(), 500));
        } catch (WebClientException e) {
            throw new GenerationException("Text generation failed: " + e.getMostSpecificCause().getMessage(), e);
        } catch (CodecException e) {
            throw new GenerationException("Text generation returned an unreadable response", e);
        }

        JsonNode content = resp == null ? null : resp.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new GenerationException("Text generation returned no content",
                    resp == null ? null : abbreviate(resp.toString(), 500));
        }
        log.debug("Completion of {} messages took {} ms", messages.size(), (System.nanoTime() - started) / 1_000_000);
        return content.asText();
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CompletionRequest(
            String model,
            List<ChatMessage> messages,
            double temperature,
            @JsonProperty("max_tokens") Integer maxTokens
    ) {}
}
