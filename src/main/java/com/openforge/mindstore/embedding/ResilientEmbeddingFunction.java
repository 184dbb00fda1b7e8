package com.openforge.mindstore.embedding;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates an {@link EmbeddingFunction} with circuit-breaker + retry.
 *
 * Call graph:
 *
 *   embed(text)
 *     └─ embeddingCircuitBreaker
 *           └─ embeddingRetry
 *                 └─ delegate.embed(text)
 *
 * Programmatic decoration, no AOP proxies. The memory engine
 * itself never retries; this wrapper is the only place that does.
 */
@Slf4j
public class ResilientEmbeddingFunction implements EmbeddingFunction {

    private final EmbeddingFunction delegate;
    private final CircuitBreaker    circuitBreaker;
    private final Retry             retry;

    public ResilientEmbeddingFunction(EmbeddingFunction delegate,
                                      CircuitBreaker circuitBreaker,
                                      Retry retry) {
        this.delegate       = delegate;
        this.circuitBreaker = circuitBreaker;
        this.retry          = retry;
    }

    @Override
    public List<Float> embed(String text) {
        Supplier<List<Float>> decorated = CircuitBreaker.decorateSupplier(circuitBreaker,
                Retry.decorateSupplier(retry, () -> delegate.embed(text)));
        try {
            return decorated.get();
        } catch (RuntimeException e) {
            log.warn("[Embed] Embedding failed after retries (circuit={}): {}",
                    circuitBreaker.getState(), e.getMessage());
            throw e;
        }
    }
}
