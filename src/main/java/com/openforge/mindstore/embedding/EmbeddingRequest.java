package com.openforge.mindstore.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One thought's text, as sent to {@code POST {base-url}/embeddings}.
 * Serialized snake_case by the shared mapper:
 * <pre>
 * {"input": "...", "model": "nomic-embed-text", "dimensions": 768, "encoding_format": "float"}
 * </pre>
 * {@code dimensions} is left out when not configured; fixed-size models ignore it anyway.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        String  input,
        String  model,
        Integer dimensions,
        String  encodingFormat
) {

    /** Thought content past this length does not change the vector enough to matter. */
    static final int MAX_INPUT_CHARS = 8000;

    static EmbeddingRequest forText(String text, EmbeddingProperties props) {
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        Integer dimensions = props.dimensions() > 0 ? props.dimensions() : null;
        return new EmbeddingRequest(input, props.model(), dimensions, "float");
    }
}
