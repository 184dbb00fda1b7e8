package com.openforge.mindstore.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Turns thought content into vectors through any server speaking the
 * OpenAI /embeddings protocol, such as a local Ollama or a hosted API.
 * One blocking call per text. Retries and the circuit breaker wrap this
 * class in {@link ResilientEmbeddingFunction}.
 */
@Slf4j
public class EmbeddingClient implements EmbeddingFunction {

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;
    private final URI                 endpoint;

    public EmbeddingClient(HttpClient httpClient, ObjectMapper objectMapper, EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
        this.endpoint     = URI.create(stripTrailingSlash(
                Objects.requireNonNull(props.baseUrl(), "mindstore.embedding.base-url is required")) + "/embeddings");
    }

    /**
     * @throws IllegalArgumentException for null or blank text
     * @throws EmbeddingException        when the server is unreachable, refuses, or answers without a vector
     */
    @Override
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        EmbeddingRequest request = EmbeddingRequest.forText(text, props);
        log.debug("[Embed] {} chars with {}", request.input().length(), props.model());

        List<Float> vector = readVector(call(request));
        if (props.dimensions() > 0 && vector.size() != props.dimensions()) {
            log.warn("[Embed] {} returned {} dimensions, configured {}; stores will reject these vectors",
                    props.model(), vector.size(), props.dimensions());
        }
        return vector;
    }

    private HttpResponse<String> call(EmbeddingRequest request) {
        HttpRequest.Builder http = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request)));
        if (props.apiKey() != null && !props.apiKey().isBlank()) {
            http.header("Authorization", "Bearer " + props.apiKey());
        }
        try {
            return httpClient.send(http.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Embedding server unreachable at " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted waiting for " + endpoint, e);
        }
    }

    private List<Float> readVector(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            throw new EmbeddingException("Embedding server rate-limited the request");
        }
        if (status / 100 != 2) {
            throw new EmbeddingException("Embedding server answered HTTP %d: %s".formatted(status, response.body()));
        }
        try {
            return objectMapper.readValue(response.body(), EmbeddingResponse.class).vector()
                    .orElseThrow(() -> new EmbeddingException("Embedding reply carried no vector"));
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Unreadable embedding reply", e);
        }
    }

    private String toJson(EmbeddingRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Could not encode embedding request", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /** The embedding server failed; retried and counted by the circuit breaker. */
    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
