package com.openforge.mindstore.thought;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps thoughts, relations and results to and from flat point payloads.
 *
 * Payload schemas:
 * <pre>
 *   thought  : id, session_id, type, origin, content, confidence, relevance,
 *              timestamp, topic, parent_thought_id?, metadata_json?
 *   relation : id, session_id, source_thought_id, target_thought_id,
 *              relation_type, strength, created_at, metadata_json?
 *   result   : id, session_id, thought_id, result_type, content, success,
 *              confidence, created_at, execution_time_ms?, metadata_json?
 * </pre>
 *
 * Parsing never throws: a payload that cannot be turned back into a record
 * yields {@link Optional#empty()} and bumps {@link #failureCount()}, so one
 * corrupt point cannot fail a whole query.
 */
@Slf4j
@Component
public class ThoughtPayloadCodec {

    public static final String SESSION_ID        = "session_id";
    public static final String TYPE              = "type";
    public static final String SOURCE_THOUGHT_ID = "source_thought_id";
    public static final String TARGET_THOUGHT_ID = "target_thought_id";
    public static final String RELATION_TYPE     = "relation_type";
    public static final String THOUGHT_ID        = "thought_id";

    /** Reserved metadata_json key carrying a thought's tags. */
    static final String TAGS_KEY = "_tags";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final AtomicLong   failures = new AtomicLong();

    public ThoughtPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Number of payloads skipped because they could not be parsed. */
    public long failureCount() {
        return failures.get();
    }

    // ── Thought ──────────────────────────────────────────────────────────────

    public Map<String, Object> toPayload(String sessionId, Thought thought) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("id",         thought.id().toString());
        p.put(SESSION_ID,   sessionId);
        p.put(TYPE,         thought.type().tag());
        p.put("origin",     thought.origin().tag());
        p.put("content",    thought.content());
        p.put("confidence", thought.confidence());
        p.put("relevance",  thought.relevance());
        p.put("timestamp",  thought.timestamp().toString());
        p.put("topic",      thought.topic() == null ? "" : thought.topic());
        if (thought.parentThoughtId() != null) {
            p.put("parent_thought_id", thought.parentThoughtId().toString());
        }

        Map<String, Object> meta = new LinkedHashMap<>(thought.metadata());
        if (!thought.tags().isEmpty()) meta.put(TAGS_KEY, thought.tags());
        if (!meta.isEmpty()) p.put("metadata_json", writeJson(meta));
        return p;
    }

    public Optional<Thought> parseThought(Map<String, Object> p) {
        try {
            Map<String, Object> meta = readMetadata(p);
            List<String> tags = new ArrayList<>();
            Object rawTags = meta.remove(TAGS_KEY);
            if (rawTags instanceof List<?> list) {
                for (Object t : list) tags.add(String.valueOf(t));
            }

            String topic  = optStr(p, "topic");
            String parent = optStr(p, "parent_thought_id");

            return Optional.of(new Thought(
                    UUID.fromString(str(p, "id")),
                    optStr(p, SESSION_ID),
                    ThoughtType.of(str(p, TYPE)),
                    ThoughtOrigin.of(str(p, "origin")),
                    str(p, "content"),
                    num(p, "confidence"),
                    num(p, "relevance"),
                    instant(str(p, "timestamp")),
                    parent == null || parent.isEmpty() ? null : UUID.fromString(parent),
                    topic == null || topic.isEmpty() ? null : topic,
                    tags,
                    meta));
        } catch (RuntimeException e) {
            return skip("thought", p, e);
        }
    }

    // ── Relation ─────────────────────────────────────────────────────────────

    public Map<String, Object> toPayload(String sessionId, ThoughtRelation relation) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("id",              relation.id().toString());
        p.put(SESSION_ID,        sessionId);
        p.put(SOURCE_THOUGHT_ID, relation.sourceThoughtId().toString());
        p.put(TARGET_THOUGHT_ID, relation.targetThoughtId().toString());
        p.put(RELATION_TYPE,     relation.type().wire());
        p.put("strength",        relation.strength());
        p.put("created_at",      relation.createdAt().toString());
        if (!relation.metadata().isEmpty()) p.put("metadata_json", writeJson(relation.metadata()));
        return p;
    }

    public Optional<ThoughtRelation> parseRelation(Map<String, Object> p) {
        try {
            return Optional.of(new ThoughtRelation(
                    UUID.fromString(str(p, "id")),
                    UUID.fromString(str(p, SOURCE_THOUGHT_ID)),
                    UUID.fromString(str(p, TARGET_THOUGHT_ID)),
                    RelationType.parse(str(p, RELATION_TYPE)),
                    num(p, "strength"),
                    instant(str(p, "created_at")),
                    readMetadata(p)));
        } catch (RuntimeException e) {
            return skip("relation", p, e);
        }
    }

    // ── Result ───────────────────────────────────────────────────────────────

    public Map<String, Object> toPayload(String sessionId, ThoughtResult result) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("id",          result.id().toString());
        p.put(SESSION_ID,    sessionId);
        p.put(THOUGHT_ID,    result.thoughtId().toString());
        p.put("result_type", result.resultType().wire());
        p.put("content",     result.content());
        p.put("success",     result.success());
        p.put("confidence",  result.confidence());
        p.put("created_at",  result.createdAt().toString());
        if (result.executionTime() != null) {
            p.put("execution_time_ms", result.executionTime().toNanos() / 1_000_000.0);
        }
        if (!result.metadata().isEmpty()) p.put("metadata_json", writeJson(result.metadata()));
        return p;
    }

    public Optional<ThoughtResult> parseResult(Map<String, Object> p) {
        try {
            Object ms = p.get("execution_time_ms");
            Duration executionTime = ms instanceof Number n
                    ? Duration.ofNanos(Math.round(n.doubleValue() * 1_000_000.0))
                    : null;

            return Optional.of(new ThoughtResult(
                    UUID.fromString(str(p, "id")),
                    UUID.fromString(str(p, THOUGHT_ID)),
                    ResultType.parse(str(p, "result_type")),
                    str(p, "content"),
                    bool(p, "success"),
                    num(p, "confidence"),
                    instant(str(p, "created_at")),
                    executionTime,
                    readMetadata(p)));
        } catch (RuntimeException e) {
            return skip("result", p, e);
        }
    }

    // ── Field extractors ─────────────────────────────────────────────────────

    private <T> Optional<T> skip(String kind, Map<String, Object> p, RuntimeException e) {
        long total = failures.incrementAndGet();
        log.debug("[Thoughts] Skipping unreadable {} point id={} ({} skipped so far): {}",
                kind, p.get("id"), total, e.getMessage());
        return Optional.empty();
    }

    private static String str(Map<String, Object> p, String key) {
        Object v = p.get(key);
        if (v == null) throw new IllegalArgumentException("missing field " + key);
        return v.toString();
    }

    @Nullable
    private static String optStr(Map<String, Object> p, String key) {
        Object v = p.get(key);
        return v == null ? null : v.toString();
    }

    private static double num(Map<String, Object> p, String key) {
        Object v = p.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) return Double.parseDouble(s);
        throw new IllegalArgumentException("missing numeric field " + key);
    }

    private static boolean bool(Map<String, Object> p, String key) {
        Object v = p.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        throw new IllegalArgumentException("missing boolean field " + key);
    }

    /** ISO-8601 with offset; a bare local date-time is read as UTC. */
    static Instant instant(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }

    private Map<String, Object> readMetadata(Map<String, Object> p) {
        String json = optStr(p, "metadata_json");
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unreadable metadata_json", e);
        }
    }

    private String writeJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("metadata is not serializable to JSON", e);
        }
    }
}
