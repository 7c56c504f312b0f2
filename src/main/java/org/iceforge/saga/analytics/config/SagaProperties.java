package org.iceforge.saga.analytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalDate;

@Validated
@ConfigurationProperties(prefix = "saga")
public class SagaProperties {

    /**
     * Location of the dataset schema YAML on the classpath.
     */
    @NotBlank
    private String schemaResource = "transactions-schema.yml";

    /**
     * Anchor for relative time windows (1m, 3m, ...). The dataset is a snapshot, so windows
     * are measured back from its last day rather than from today.
     */
    @NotNull
    private LocalDate referenceDate = LocalDate.of(2024, 12, 6);

    /**
     * Number of past chat exchanges replayed into each decomposition prompt.
     */
    @Min(0)
    private int historyWindow = 5;

    @Min(1)
    private int maxSubQuestions = 8;

    @Min(1)
    private int maxCharts = 4;

    @Valid
    private final Llm llm = new Llm();

    @Valid
    private final Answerer answerer = new Answerer();

    @Valid
    private final Charts charts = new Charts();

    @Valid
    private final Memory memory = new Memory();

    public String getSchemaResource() {
        return schemaResource;
    }

    public void setSchemaResource(String schemaResource) {
        this.schemaResource = schemaResource;
    }

    public LocalDate getReferenceDate() {
        return referenceDate;
    }

    public void setReferenceDate(LocalDate referenceDate) {
        this.referenceDate = referenceDate;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public int getMaxSubQuestions() {
        return maxSubQuestions;
    }

    public void setMaxSubQuestions(int maxSubQuestions) {
        this.maxSubQuestions = maxSubQuestions;
    }

    public int getMaxCharts() {
        return maxCharts;
    }

    public void setMaxCharts(int maxCharts) {
        this.maxCharts = maxCharts;
    }

    public Llm getLlm() {
        return llm;
    }

    public Answerer getAnswerer() {
        return answerer;
    }

    public Charts getCharts() {
        return charts;
    }

    public Memory getMemory() {
        return memory;
    }

    public static class Llm {

        /**
         * Base URL of an OpenAI-compatible API, e.g. https://api.openai.com/v1
         */
        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";

        @NotBlank
        private String chatPath = "/chat/completions";

        /**
         * Bearer key. Left blank, every text-generation call fails with a configuration error.
         */
        private String apiKey = "";

        @NotBlank
        private String model = "gpt-3.5-turbo";

        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getChatPath() {
            return chatPath;
        }

        public void setChatPath(String chatPath) {
            this.chatPath = chatPath;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Answerer {

        /**
         * Row cap applied to each generated sub-question query.
         */
        @Min(1)
        private int maxRows = 200;

        @Min(1)
        @Max(600)
        private int queryTimeoutSeconds = 30;

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }

        public int getQueryTimeoutSeconds() {
            return queryTimeoutSeconds;
        }

        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
        }
    }

    public static class Charts {

        /**
         * Row cap for each chart query; the prompt asks for 15 rows but nothing enforces it.
         */
        @Min(1)
        private int maxRows = 500;

        @Min(1)
        @Max(600)
        private int queryTimeoutSeconds = 30;

        public int getMaxRows() {
            return maxRows;
        }

        public void setMaxRows(int maxRows) {
            this.maxRows = maxRows;
        }

        public int getQueryTimeoutSeconds() {
            return queryTimeoutSeconds;
        }

        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
        }
    }

    public static class Memory {

        /**
         * When false, log appends run on the calling thread (used by tests).
         */
        private boolean async = true;

        @Min(1)
        private int queueCapacity = 256;

        public boolean isAsync() {
            return async;
        }

        public void setAsync(boolean async) {
            this.async = async;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
