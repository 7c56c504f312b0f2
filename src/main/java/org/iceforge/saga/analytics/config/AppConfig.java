package org.iceforge.saga.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.netty.channel.ChannelOption;
import org.iceforge.saga.analytics.service.memory.LogWriteChannel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(SagaProperties.class)
public class AppConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    @Bean
    public ObjectMapper yamlObjectMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    @Bean
    public WebClient llmWebClient(SagaProperties props) {
        SagaProperties.Llm llm = props.getLlm();
        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(llm.getTimeout());

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(llm.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http));
        if (StringUtils.hasText(llm.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + llm.getApiKey());
        }
        return builder.build();
    }

    @Bean
    public LogWriteChannel logWriteChannel(SagaProperties props) {
        SagaProperties.Memory memory = props.getMemory();
        return memory.isAsync()
                ? LogWriteChannel.async(memory.getQueueCapacity())
                : LogWriteChannel.direct();
    }
}
