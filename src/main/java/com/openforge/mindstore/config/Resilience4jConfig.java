package com.openforge.mindstore.config;

import com.openforge.mindstore.embedding.EmbeddingClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring for the embedding endpoint.
 *
 * One named instance, "embedding", wraps every call made through
 * {@link com.openforge.mindstore.embedding.ResilientEmbeddingFunction}.
 * Vector-backend calls are deliberately not wrapped: backend failures
 * surface immediately to the caller.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .failureRateThreshold(50)
                // treat slow calls (>10 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(10))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(EmbeddingClient.EmbeddingException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker("embedding");
        return registry;
    }

    @Bean
    public CircuitBreaker embeddingCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("embedding");
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                // network errors and 429 surface as EmbeddingException
                .retryExceptions(EmbeddingClient.EmbeddingException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry("embedding");
        return registry;
    }

    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        return registry.retry("embedding");
    }
}
