package com.openforge.mindstore.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * mindstore:
 *   embedding:
 *     enabled: true
 *     base-url: http://localhost:11434/v1
 *     api-key: ${EMBEDDING_API_KEY:ollama}
 *     model: nomic-embed-text
 *     dimensions: 768
 *     timeout-seconds: 30
 *
 * Dimension reference:
 *   nomic-embed-text        → 768
 *   text-embedding-3-small  → 1536
 *   text-embedding-3-large  → 3072
 *
 * The dimension must match mindstore.thoughts.vector-size, otherwise the
 * collection health check reports a dimension mismatch.
 */
@ConfigurationProperties(prefix = "mindstore.embedding")
public record EmbeddingProperties(
        @DefaultValue("true") boolean enabled,
        String baseUrl,
        String apiKey,
        @DefaultValue("nomic-embed-text") String model,
        @DefaultValue("768") int dimensions,
        @DefaultValue("30") int timeoutSeconds
) {}
