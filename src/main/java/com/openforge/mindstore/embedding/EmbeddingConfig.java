package com.openforge.mindstore.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Wires the system {@link EmbeddingFunction}: HTTP client wrapped in
 * resilience. Disabled with mindstore.embedding.enabled=false, in which case
 * no EmbeddingFunction bean exists and the memory engine runs text-only.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
@ConditionalOnProperty(name = "mindstore.embedding.enabled", havingValue = "true", matchIfMissing = true)
public class EmbeddingConfig {

    @Bean
    public EmbeddingFunction embeddingFunction(HttpClient httpClient,
                                               ObjectMapper objectMapper,
                                               EmbeddingProperties props,
                                               CircuitBreaker embeddingCircuitBreaker,
                                               Retry embeddingRetry) {
        log.info("[Embed] Using model '{}' (dim={}) at {}", props.model(), props.dimensions(), props.baseUrl());
        return new ResilientEmbeddingFunction(
                new EmbeddingClient(httpClient, objectMapper, props),
                embeddingCircuitBreaker,
                embeddingRetry);
    }
}
