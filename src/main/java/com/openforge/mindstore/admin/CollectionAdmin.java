package com.openforge.mindstore.admin;

import com.openforge.mindstore.thought.ThoughtCollectionManager;
import com.openforge.mindstore.vector.CollectionDescription;
import com.openforge.mindstore.vector.CollectionStatus;
import com.openforge.mindstore.vector.Distance;
import com.openforge.mindstore.vector.VectorBackendClient;
import com.openforge.mindstore.vector.VectorBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Administration of every collection in the vector backend.
 *
 * ┌──────────────────────┬─────────────────────────────────────────────┐
 * │ Operation            │ Effect                                      │
 * ├──────────────────────┼─────────────────────────────────────────────┤
 * │ create / delete      │ collection lifecycle, keeps the link graph  │
 * │ healthCheck          │ flags collections whose dimension differs   │
 * │ autoHeal             │ drops + recreates flagged ones (data loss!) │
 * │ link graph           │ typed edges between collections             │
 * │ generateMemoryMap    │ boxed text overview for operators           │
 * └──────────────────────┴─────────────────────────────────────────────┘
 *
 * The collection cache and the link list are guarded by one read/write
 * lock. A failed cache refresh keeps the previous cache.
 */
@Slf4j
@Service
public class CollectionAdmin {

    /** Purpose of every collection the agent is known to use. */
    public static final Map<String, String> KNOWN_COLLECTIONS;

    static {
        Map<String, String> known = new LinkedHashMap<>();
        known.put("mindstore_neuro_thoughts",    "Neural-symbolic thought storage for inner dialog");
        known.put("mindstore_thought_relations", "Symbolic relations between thoughts");
        known.put("mindstore_thought_results",   "Outcomes and results of thought chains");
        known.put("mindstore_conversations",     "Conversation history and context");
        known.put("mindstore_skills",            "Learned skills and capabilities");
        known.put("mindstore_tool_patterns",     "Tool usage patterns and preferences");
        known.put("mindstore_personalities",     "Personality trait vectors");
        known.put("mindstore_persons",           "Known persons and their attributes");
        known.put("mindstore_selfindex",         "Self-referential knowledge index");
        known.put("mindstore_filehashes",        "File content hashes for deduplication");
        known.put("pipeline_vectors",            "General pipeline vector storage");
        known.put("tools",                       "Tool definitions and embeddings");
        known.put("core",                        "Core knowledge embeddings");
        known.put("fullcore",                    "Full codebase embeddings");
        known.put("codebase",                    "Source code embeddings");
        known.put("prefix_cache",                "Prefix-based completion cache");
        known.put("documentation",               "Documentation embeddings");
        KNOWN_COLLECTIONS = Collections.unmodifiableMap(known);
    }

    public static final List<CollectionLink> DEFAULT_LINKS = List.of(
            new CollectionLink("mindstore_neuro_thoughts", "mindstore_thought_relations",
                    CollectionLink.LinkType.INDEXES, 1.0, "Thoughts indexed by relations"),
            new CollectionLink("mindstore_neuro_thoughts", "mindstore_thought_results",
                    CollectionLink.LinkType.EXTENDS, 1.0, "Thoughts extend to results"),
            new CollectionLink("mindstore_skills", "mindstore_tool_patterns",
                    CollectionLink.LinkType.RELATED_TO, 0.8, "Skills inform tool patterns"),
            new CollectionLink("mindstore_conversations", "mindstore_neuro_thoughts",
                    CollectionLink.LinkType.DEPENDS_ON, 0.9, "Conversations feed thoughts"),
            new CollectionLink("mindstore_personalities", "mindstore_persons",
                    CollectionLink.LinkType.RELATED_TO, 0.7, "Personalities relate to persons"),
            new CollectionLink("mindstore_selfindex", "mindstore_neuro_thoughts",
                    CollectionLink.LinkType.AGGREGATES, 1.0, "Self-index aggregates thoughts"),
            new CollectionLink("core", "fullcore",
                    CollectionLink.LinkType.PART_OF, 1.0, "Core is part of fullcore"),
            new CollectionLink("codebase", "fullcore",
                    CollectionLink.LinkType.PART_OF, 1.0, "Codebase is part of fullcore"));

    private final VectorBackendClient      backend;
    private final AdminProperties          props;
    private final ThoughtCollectionManager thoughtCollections;

    private final ReadWriteLock               lock           = new ReentrantReadWriteLock();
    private final Map<String, CollectionInfo> cache          = new TreeMap<>();
    private final List<CollectionLink>        links          = new ArrayList<>();
    private final Map<String, String>         customPurposes = new ConcurrentHashMap<>();

    public CollectionAdmin(VectorBackendClient backend,
                           AdminProperties props,
                           ThoughtCollectionManager thoughtCollections) {
        this.backend            = backend;
        this.props              = props;
        this.thoughtCollections = thoughtCollections;
    }

    /** Seeds the default link graph and loads the collection cache. Idempotent. */
    public void initialize() {
        DEFAULT_LINKS.forEach(this::addCollectionLink);
        refreshCache();
        log.info("[Admin] Initialized: {} collection(s), {} link(s)", cacheSize(), linkCount());
    }

    // ── Collections ──────────────────────────────────────────────────────────

    public List<CollectionInfo> getAllCollections() {
        refreshCache();
        lock.readLock().lock();
        try {
            return List.copyOf(cache.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Empty when the collection does not exist or the backend cannot describe it. */
    public Optional<CollectionInfo> getCollectionInfo(String name) {
        Optional<CollectionDescription> description;
        try {
            description = backend.describeCollection(name);
        } catch (VectorBackendException e) {
            log.warn("[Admin] Cannot describe collection '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
        return description.map(this::toInfo);
    }

    public boolean createCollection(String name) {
        return createCollection(name, props.defaultVectorSize(), Distance.COSINE, null);
    }

    /** @return false if the collection already exists */
    public boolean createCollection(String name, int vectorSize, Distance distance, @Nullable String purpose) {
        if (backend.collectionExists(name)) return false;

        backend.createCollection(name, vectorSize, distance);
        if (purpose != null) customPurposes.put(name, purpose);

        CollectionInfo info = new CollectionInfo(name, vectorSize, 0, distance, CollectionStatus.GREEN,
                purposeOf(name), linkedNames(name));
        lock.writeLock().lock();
        try {
            cache.put(name, info);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Admin] Created collection '{}' (dim={}, {})", name, vectorSize, distance);
        return true;
    }

    /** @return false if the collection does not exist; links touching it are removed */
    public boolean deleteCollection(String name) {
        if (!backend.collectionExists(name)) return false;

        backend.deleteCollection(name);
        thoughtCollections.forget(name);
        customPurposes.remove(name);
        lock.writeLock().lock();
        try {
            cache.remove(name);
            links.removeIf(l -> l.touches(name));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Admin] Deleted collection '{}'", name);
        return true;
    }

    // ── Health ───────────────────────────────────────────────────────────────

    public List<CollectionHealthReport> healthCheck() {
        return healthCheck(props.defaultVectorSize());
    }

    /** A collection is mismatched when its vector size is known (> 0) and differs. */
    public List<CollectionHealthReport> healthCheck(int expectedDimension) {
        return getAllCollections().stream()
                .map(info -> CollectionHealthReport.of(info, expectedDimension))
                .toList();
    }

    /**
     * Drops and recreates every mismatched collection, empty, at
     * {@code targetDimension} and with its previous distance metric.
     * ALL DATA IN THOSE COLLECTIONS IS LOST, hence the explicit confirmation.
     *
     * @return names of the healed collections; empty when not confirmed
     */
    public List<String> autoHeal(int targetDimension, boolean confirmed) {
        if (!confirmed) {
            log.warn("[Admin] Auto-heal to dim={} requested without confirmation, nothing touched.", targetDimension);
            return List.of();
        }

        List<String> healed = new ArrayList<>();
        for (CollectionHealthReport report : healthCheck(targetDimension)) {
            if (!report.dimensionMismatch()) continue;
            String name = report.collectionName();
            Distance distance = cached(name).map(CollectionInfo::distanceMetric).orElse(Distance.COSINE);
            try {
                backend.deleteCollection(name);
                thoughtCollections.forget(name);
                backend.createCollection(name, targetDimension, distance);
                healed.add(name);
                log.warn("[Admin] Healed '{}': {}d → {}d, all points dropped",
                        name, report.actualDimension(), targetDimension);
            } catch (VectorBackendException e) {
                log.error("[Admin] Could not heal '{}', skipping: {}", name, e.getMessage());
            }
        }

        refreshCache();
        return healed;
    }

    public MemoryStatistics getMemoryStatistics() {
        List<CollectionInfo> all = getAllCollections();
        long totalVectors = all.stream().mapToLong(CollectionInfo::pointsCount).sum();
        int healthy = (int) all.stream().filter(CollectionInfo::isGreen).count();

        Map<Integer, Integer> dimensions = new TreeMap<>();
        for (CollectionInfo info : all) {
            dimensions.merge(info.vectorSize(), 1, Integer::sum);
        }
        return new MemoryStatistics(all.size(), totalVectors, healthy, all.size() - healthy, linkCount(), dimensions);
    }

    // ── Link graph ───────────────────────────────────────────────────────────

    /** Adds a link unless one with the same source, target and type exists. */
    public void addCollectionLink(CollectionLink link) {
        lock.writeLock().lock();
        try {
            if (links.stream().noneMatch(l -> l.sameEdge(link))) {
                links.add(link);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<CollectionLink> getCollectionLinks() {
        lock.readLock().lock();
        try {
            return List.copyOf(links);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Links in which the collection is source or target. */
    public List<CollectionLink> getLinkedCollections(String name) {
        lock.readLock().lock();
        try {
            return links.stream().filter(l -> l.touches(name)).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Collections on the other end of links of the given type, in either direction. */
    public List<String> getCollectionsByRelation(String name, CollectionLink.LinkType type) {
        Set<String> related = new LinkedHashSet<>();
        lock.readLock().lock();
        try {
            for (CollectionLink l : links) {
                if (l.relationType() == type && l.sourceCollection().equals(name)) related.add(l.targetCollection());
            }
            for (CollectionLink l : links) {
                if (l.relationType() == type && l.targetCollection().equals(name)) related.add(l.sourceCollection());
            }
        } finally {
            lock.readLock().unlock();
        }
        return new ArrayList<>(related);
    }

    public String generateMemoryMap() {
        List<CollectionInfo> all = getAllCollections();
        return MemoryMapRenderer.render(all, getCollectionLinks());
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private void refreshCache() {
        Map<String, CollectionInfo> fresh = new TreeMap<>();
        try {
            for (String name : backend.listCollections()) {
                backend.describeCollection(name).map(this::toInfo).ifPresent(info -> fresh.put(name, info));
            }
        } catch (VectorBackendException e) {
            log.warn("[Admin] Collection refresh failed, keeping previous cache: {}", e.getMessage());
            return;
        }

        lock.writeLock().lock();
        try {
            cache.clear();
            cache.putAll(fresh);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private CollectionInfo toInfo(CollectionDescription d) {
        return new CollectionInfo(d.name(), d.vectorSize(), d.pointsCount(), d.distance(), d.status(),
                purposeOf(d.name()), linkedNames(d.name()));
    }

    @Nullable
    private String purposeOf(String name) {
        String custom = customPurposes.get(name);
        return custom != null ? custom : KNOWN_COLLECTIONS.get(name);
    }

    private List<String> linkedNames(String name) {
        Set<String> names = new LinkedHashSet<>();
        for (CollectionLink l : getLinkedCollections(name)) {
            names.add(l.sourceCollection().equals(name) ? l.targetCollection() : l.sourceCollection());
        }
        return new ArrayList<>(names);
    }

    private Optional<CollectionInfo> cached(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(cache.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    private int cacheSize() {
        lock.readLock().lock();
        try {
            return cache.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private int linkCount() {
        lock.readLock().lock();
        try {
            return links.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
