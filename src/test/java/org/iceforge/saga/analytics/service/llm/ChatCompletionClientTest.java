package org.iceforge.saga.analytics.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.iceforge.saga.analytics.config.AppConfig;
import org.iceforge.saga.analytics.config.SagaProperties;
import org.iceforge.saga.analytics.service.CapabilityUnavailableException;
import org.iceforge.saga.analytics.service.GenerationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatCompletionClientTest {

    private MockWebServer llm;
    private SagaProperties props;

    @BeforeEach
    void setUp() throws IOException {
        llm = new MockWebServer();
        llm.start();
        props = new SagaProperties();
        props.getLlm().setBaseUrl(llm.url("/v1").toString());
        props.getLlm().setApiKey("test-key");
    }

    @AfterEach
    void tearDown() throws IOException {
        llm.shutdown();
    }

    private ChatCompletionClient client() {
        return new ChatCompletionClient(new AppConfig().llmWebClient(props), props);
    }

    @Test
    void postsMessagesAndReturnsFirstChoice() throws Exception {
        llm.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Hello there\"}}]}"));

        String text = client().complete(
                List.of(ChatMessage.system("be brief"), ChatMessage.user("hi")), GenerationOptions.of(0.2, 1500));

        assertThat(text).isEqualTo("Hello there");

        RecordedRequest req = llm.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(req.getHeader("Authorization")).isEqualTo("Bearer test-key");

        JsonNode body = new ObjectMapper().readTree(req.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-3.5-turbo");
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.2);
        assertThat(body.path("max_tokens").asInt()).isEqualTo(1500);
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("hi");
    }

    @Test
    void omitsMaxTokensWhenUnset() throws Exception {
        llm.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}"));

        client().complete(List.of(ChatMessage.user("hi")), new GenerationOptions(0.0, null));

        JsonNode body = new ObjectMapper().readTree(llm.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
        assertThat(body.has("max_tokens")).isFalse();
    }

    @Test
    void httpErrorBecomesGenerationError() {
        llm.enqueue(new MockResponse().setResponseCode(429).setBody("rate limited"));

        assertThatThrownBy(() -> client().complete(List.of(ChatMessage.user("hi")), GenerationOptions.of(0.7, 10)))
                .isInstanceOfSatisfying(GenerationException.class, e -> {
                    assertThat(e.getMessage()).contains("429");
                    assertThat(e.getRawExcerpt()).isEqualTo("rate limited");
                });
    }

    @Test
    void unreadableBodyBecomesGenerationError() {
        llm.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("not json"));

        assertThatThrownBy(() -> client().complete(List.of(ChatMessage.user("hi")), GenerationOptions.of(0.7, 10)))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("unreadable");
    }

    @Test
    void missingContentBecomesGenerationError() {
        llm.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[]}"));

        assertThatThrownBy(() -> client().complete(List.of(ChatMessage.user("hi")), GenerationOptions.of(0.7, 10)))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Text generation returned no content");
    }

    @Test
    void blankKeyMeansNotConfigured() {
        props.getLlm().setApiKey(" ");

        assertThatThrownBy(() -> client().complete(List.of(ChatMessage.user("hi")), GenerationOptions.of(0.7, 10)))
                .isInstanceOf(CapabilityUnavailableException.class);
        assertThat(llm.getRequestCount()).isZero();
    }
}
