package com.openforge.mindstore.thought;

import com.openforge.mindstore.embedding.EmbeddingFunction;
import com.openforge.mindstore.vector.PointFilter;
import com.openforge.mindstore.vector.ScoredPoint;
import com.openforge.mindstore.vector.ScrollPage;
import com.openforge.mindstore.vector.StoredPoint;
import com.openforge.mindstore.vector.VectorBackendClient;
import com.openforge.mindstore.vector.VectorBackendException;
import com.openforge.mindstore.vector.VectorPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Session-scoped thought memory over the vector backend.
 *
 * Three operation groups:
 *
 *   save*()   → embed + upsert, serialized per session
 *   get*()    → scroll by session filter, sorted by timestamp
 *   search()  → ANN search inside the session, substring match without embeddings
 *
 * Reads are lenient: a collection that is missing or unreachable yields an
 * empty result, so "empty" means "nothing available right now", not
 * "nothing stored". Writes propagate {@link VectorBackendException}.
 */
@Slf4j
@Service
public class ThoughtStore {

    private final VectorBackendClient      backend;
    @Nullable
    private final EmbeddingFunction        embeddingFunction;
    private final ThoughtStoreProperties   props;
    private final ThoughtPayloadCodec      codec;
    private final ThoughtCollectionManager collections;
    private final SessionLockRegistry      sessionLocks = new SessionLockRegistry();

    public ThoughtStore(VectorBackendClient backend,
                        @Nullable EmbeddingFunction embeddingFunction,
                        ThoughtStoreProperties props,
                        ThoughtPayloadCodec codec,
                        ThoughtCollectionManager collections) {
        this.backend           = backend;
        this.embeddingFunction = embeddingFunction;
        this.props             = props;
        this.codec             = codec;
        this.collections       = collections;
        if (embeddingFunction == null) {
            log.warn("[Thoughts] No embedding function, search falls back to substring match.");
        }
    }

    /** Creates the thought, relation and result collections if missing. */
    public void initialize() {
        collections.ensureAll();
        log.info("[Thoughts] Collections ready: {}", collections.allCollections());
    }

    public boolean supportsSemanticSearch() {
        return embeddingFunction != null;
    }

    // ── Save ─────────────────────────────────────────────────────────────────

    public void saveThought(String sessionId, Thought thought) {
        saveEmbedded(sessionId, thought, embed(thought.content()));
    }

    /**
     * Saves a thought whose content has already been embedded.
     * Used by relation inference to avoid embedding the same text twice.
     */
    public void saveEmbedded(String sessionId, Thought thought, List<Float> vector) {
        requireSession(sessionId);
        VectorPoint point = new VectorPoint(thought.id().toString(), vector, codec.toPayload(sessionId, thought));

        sessionLocks.withLock(sessionId, () -> {
            collections.ensureCollection(props.thoughtsCollection());
            backend.upsert(props.thoughtsCollection(), List.of(point));
        });
        log.debug("[Thoughts] Saved {} thought {} for session {}", thought.type().tag(), thought.id(), sessionId);
    }

    /**
     * Batch save. Chunks go out sequentially, in input order, so a duplicate
     * id later in the batch wins.
     */
    public void saveThoughts(String sessionId, List<Thought> thoughts) {
        requireSession(sessionId);
        if (thoughts.isEmpty()) return;

        List<VectorPoint> points = new ArrayList<>(thoughts.size());
        for (Thought t : thoughts) {
            points.add(new VectorPoint(t.id().toString(), embed(t.content()), codec.toPayload(sessionId, t)));
        }

        int batchSize = Math.max(1, props.batchSize());
        sessionLocks.withLock(sessionId, () -> {
            collections.ensureCollection(props.thoughtsCollection());
            for (int from = 0; from < points.size(); from += batchSize) {
                List<VectorPoint> chunk = points.subList(from, Math.min(from + batchSize, points.size()));
                backend.upsert(props.thoughtsCollection(), new ArrayList<>(chunk));
            }
        });
        log.debug("[Thoughts] Saved {} thought(s) for session {} in chunks of {}",
                points.size(), sessionId, batchSize);
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    /** All thoughts of the session in chronological order; [] for an unknown session. */
    public List<Thought> getThoughts(String sessionId) {
        requireSession(sessionId);
        List<Thought> thoughts = new ArrayList<>();
        for (StoredPoint p : scrollAll(props.thoughtsCollection(), sessionFilter(sessionId))) {
            codec.parseThought(p.payload()).ifPresent(thoughts::add);
        }
        thoughts.sort(Comparator.comparing(Thought::timestamp));
        return thoughts;
    }

    /** Thoughts with {@code from <= timestamp <= to}. */
    public List<Thought> getThoughtsInRange(String sessionId, Instant from, Instant to) {
        return getThoughts(sessionId).stream()
                .filter(t -> !t.timestamp().isBefore(from) && !t.timestamp().isAfter(to))
                .toList();
    }

    public List<Thought> getThoughtsByType(String sessionId, ThoughtType type, int limit) {
        requireSession(sessionId);
        PointFilter filter = sessionFilter(sessionId).and(ThoughtPayloadCodec.TYPE, type.tag());
        List<Thought> thoughts = new ArrayList<>();
        for (StoredPoint p : scrollAll(props.thoughtsCollection(), filter)) {
            codec.parseThought(p.payload()).ifPresent(thoughts::add);
        }
        return thoughts.stream()
                .sorted(Comparator.comparing(Thought::timestamp))
                .limit(Math.max(0, limit))
                .toList();
    }

    /** The {@code count} newest thoughts, newest first. */
    public List<Thought> getRecentThoughts(String sessionId, int count) {
        List<Thought> all = new ArrayList<>(getThoughts(sessionId));
        Collections.reverse(all);
        return all.stream().limit(Math.max(0, count)).toList();
    }

    /**
     * Semantic search inside the session when an embedding function is
     * configured, otherwise case-insensitive substring match over content.
     */
    public List<Thought> searchThoughts(String sessionId, String query, int limit) {
        requireSession(sessionId);
        if (query == null || query.isBlank()) return List.of();

        if (embeddingFunction == null) {
            String needle = query.toLowerCase(Locale.ROOT);
            return getThoughts(sessionId).stream()
                    .filter(t -> t.content().toLowerCase(Locale.ROOT).contains(needle))
                    .limit(Math.max(0, limit))
                    .toList();
        }

        List<Float> queryVector = embeddingFunction.embed(query);
        List<ScoredPoint> hits;
        try {
            collections.ensureCollection(props.thoughtsCollection());
            hits = backend.search(props.thoughtsCollection(), queryVector, sessionFilter(sessionId), limit, null);
        } catch (VectorBackendException e) {
            log.warn("[Thoughts] Search unavailable for session {}: {}", sessionId, e.getMessage());
            return List.of();
        }

        List<Thought> results = new ArrayList<>();
        for (ScoredPoint hit : hits) {
            codec.parseThought(hit.payload()).ifPresent(results::add);
        }
        return results;
    }

    /**
     * Every descendant of {@code parentId} through parent-thought links,
     * breadth-first. Iterative, never revisits a thought and stops at
     * {@code maxChainDepth} levels below the parent.
     */
    public List<Thought> getChainedThoughts(String sessionId, UUID parentId) {
        Map<UUID, List<Thought>> children = new HashMap<>();
        for (Thought t : getThoughts(sessionId)) {
            if (t.parentThoughtId() != null) {
                children.computeIfAbsent(t.parentThoughtId(), k -> new ArrayList<>()).add(t);
            }
        }

        List<Thought> chained = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        seen.add(parentId);
        Deque<UUID> frontier = new ArrayDeque<>(List.of(parentId));

        for (int depth = 0; depth < props.maxChainDepth() && !frontier.isEmpty(); depth++) {
            Deque<UUID> next = new ArrayDeque<>();
            for (UUID id : frontier) {
                for (Thought child : children.getOrDefault(id, List.of())) {
                    if (seen.add(child.id())) {
                        chained.add(child);
                        next.add(child.id());
                    }
                }
            }
            frontier = next;
        }
        if (!frontier.isEmpty()) {
            log.debug("[Thoughts] Chain below {} truncated at depth {}", parentId, props.maxChainDepth());
        }
        return chained;
    }

    /** Session ids that currently have at least one stored thought, sorted. */
    public List<String> listSessions() {
        Set<String> sessions = new TreeSet<>();
        for (StoredPoint p : scrollAll(props.thoughtsCollection(), null)) {
            Object s = p.payload().get(ThoughtPayloadCodec.SESSION_ID);
            if (s != null && !s.toString().isEmpty()) sessions.add(s.toString());
        }
        return new ArrayList<>(sessions);
    }

    public ThoughtStatistics getStatistics(String sessionId) {
        List<Thought> thoughts = getThoughts(sessionId);
        if (thoughts.isEmpty()) return ThoughtStatistics.empty();

        return new ThoughtStatistics(
                thoughts.size(),
                countBy(thoughts, t -> t.type().tag()),
                countBy(thoughts, t -> t.origin().tag()),
                thoughts.stream().mapToDouble(Thought::confidence).average().orElse(0.0),
                thoughts.stream().mapToDouble(Thought::relevance).average().orElse(0.0),
                thoughts.get(0).timestamp(),
                thoughts.get(thoughts.size() - 1).timestamp());
    }

    // ── Delete ───────────────────────────────────────────────────────────────

    /** Deletes the session's thoughts, relations and results. */
    public void clearSession(String sessionId) {
        requireSession(sessionId);
        PointFilter filter = sessionFilter(sessionId);
        sessionLocks.withLock(sessionId, () -> {
            for (String collection : collections.allCollections()) {
                collections.ensureCollection(collection);
                backend.delete(collection, filter);
            }
        });
        log.info("[Thoughts] Cleared session {}", sessionId);
    }

    // ── Shared helpers (also used by the relation / result stores) ───────────

    /**
     * Scrolls every page of points matching the filter.
     * Lenient: missing or unreachable collection → [].
     */
    List<StoredPoint> scrollAll(String collection, @Nullable PointFilter filter) {
        List<StoredPoint> all = new ArrayList<>();
        try {
            collections.ensureCollection(collection);
            String cursor = null;
            do {
                ScrollPage page = backend.scroll(collection, filter, props.scrollPageSize(), cursor);
                all.addAll(page.points());
                cursor = page.nextCursor();
            } while (cursor != null);
        } catch (VectorBackendException e) {
            log.warn("[Thoughts] Read from '{}' unavailable, returning empty: {}", collection, e.getMessage());
            return List.of();
        }
        return all;
    }

    /** Embeds text, or returns the zero vector when no embedding function is configured. */
    List<Float> embed(String text) {
        if (embeddingFunction == null || text == null || text.isBlank()) {
            return zeroVector();
        }
        return embeddingFunction.embed(text);
    }

    /** Shared with the relation and result stores so every write to a session serializes on one lock. */
    SessionLockRegistry sessionLocks() {
        return sessionLocks;
    }

    List<Float> zeroVector() {
        return Collections.nCopies(props.vectorSize(), 0.0f);
    }

    static PointFilter sessionFilter(String sessionId) {
        return PointFilter.matching(ThoughtPayloadCodec.SESSION_ID, sessionId);
    }

    static void requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }

    static <T> Map<String, Integer> countBy(List<T> items, Function<T, String> key) {
        return items.stream().collect(Collectors.groupingBy(
                key, TreeMap::new, Collectors.reducing(0, e -> 1, Integer::sum)));
    }

    @Nullable
    EmbeddingFunction embeddingFunction() {
        return embeddingFunction;
    }

    ThoughtStoreProperties properties() {
        return props;
    }
}
