package com.openforge.mindstore.layer;

import com.openforge.mindstore.admin.AdminProperties;
import com.openforge.mindstore.admin.CollectionAdmin;
import com.openforge.mindstore.admin.CollectionHealthReport;
import com.openforge.mindstore.admin.CollectionInfo;
import com.openforge.mindstore.admin.CollectionLink;
import com.openforge.mindstore.admin.MemoryStatistics;
import com.openforge.mindstore.vector.Distance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps vector collections onto cognitive memory layers.
 *
 * ┌──────────────────┬──────────────────────────────────────────────────┬──────┐
 * │ Layer            │ Collections                                      │ Keep │
 * ├──────────────────┼──────────────────────────────────────────────────┼──────┤
 * │ WORKING          │ neuro_thoughts                                   │ 1.0  │
 * │ EPISODIC         │ conversations, thought_results                   │ 0.9  │
 * │ SEMANTIC         │ core, fullcore, codebase, documentation          │ 0.7  │
 * │ PROCEDURAL       │ skills, tool_patterns, tools                     │ 0.8  │
 * │ AUTOBIOGRAPHICAL │ personalities, persons, selfindex                │ 0.95 │
 * └──────────────────┴──────────────────────────────────────────────────┴──────┘
 *
 * A collection belongs to at most one layer; a mapping that puts one
 * collection into two layers is rejected at construction.
 */
@Slf4j
@Service
public class MemoryLayerManager {

    public static final List<MemoryLayerMapping> DEFAULT_MAPPINGS = List.of(
            new MemoryLayerMapping(MemoryLayer.WORKING,
                    List.of("mindstore_neuro_thoughts"),
                    "Active thought processes and immediate reasoning", 1.0),
            new MemoryLayerMapping(MemoryLayer.EPISODIC,
                    List.of("mindstore_conversations", "mindstore_thought_results"),
                    "Recent interactions and their outcomes", 0.9),
            new MemoryLayerMapping(MemoryLayer.SEMANTIC,
                    List.of("core", "fullcore", "codebase", "documentation"),
                    "Learned facts, concepts, and domain knowledge", 0.7),
            new MemoryLayerMapping(MemoryLayer.PROCEDURAL,
                    List.of("mindstore_skills", "mindstore_tool_patterns", "tools"),
                    "Learned skills, tool usage patterns, and procedures", 0.8),
            new MemoryLayerMapping(MemoryLayer.AUTOBIOGRAPHICAL,
                    List.of("mindstore_personalities", "mindstore_persons", "mindstore_selfindex"),
                    "Self-model, identity, and known entities", 0.95));

    private final CollectionAdmin                      admin;
    private final AdminProperties                      props;
    private final Clock                                clock;
    private final Map<MemoryLayer, MemoryLayerMapping> mappings;
    private final Map<String, MemoryLayer>             layerByCollection;

    private volatile boolean initialized;

    /** Built-in mapping, with per-layer collection lists overridable via {@code mindstore.admin.layers}. */
    @Autowired
    public MemoryLayerManager(CollectionAdmin admin, AdminProperties props, Clock clock) {
        this(admin, props, clock, applyOverrides(DEFAULT_MAPPINGS, props.layers()));
    }

    public MemoryLayerManager(CollectionAdmin admin,
                              AdminProperties props,
                              Clock clock,
                              Collection<MemoryLayerMapping> mappings) {
        this.admin    = admin;
        this.props    = props;
        this.clock    = clock;
        this.mappings = new EnumMap<>(MemoryLayer.class);
        this.layerByCollection = new HashMap<>();

        for (MemoryLayerMapping mapping : mappings) {
            if (this.mappings.put(mapping.layer(), mapping) != null) {
                throw new IllegalArgumentException("Layer " + mapping.layer() + " is mapped twice");
            }
            for (String collection : mapping.collections()) {
                MemoryLayer previous = layerByCollection.put(collection, mapping.layer());
                if (previous != null) {
                    throw new IllegalArgumentException("Collection '" + collection + "' is mapped to both "
                            + previous + " and " + mapping.layer());
                }
            }
        }
    }

    /**
     * Initializes the collection admin and creates every mapped collection
     * that does not exist yet. Runs once.
     */
    public synchronized void initialize() {
        if (initialized) return;

        admin.initialize();
        for (MemoryLayerMapping mapping : mappings.values()) {
            for (String collection : mapping.collections()) {
                if (admin.getCollectionInfo(collection).isPresent()) continue;
                String purpose = CollectionAdmin.KNOWN_COLLECTIONS.getOrDefault(collection, mapping.description());
                admin.createCollection(collection, props.defaultVectorSize(), Distance.COSINE, purpose);
            }
        }
        initialized = true;
        log.info("[Memory] Layers ready: {}", mappings.keySet());
    }

    // ── Layer lookup ─────────────────────────────────────────────────────────

    public List<String> getCollectionsForLayer(MemoryLayer layer) {
        MemoryLayerMapping mapping = mappings.get(layer);
        return mapping == null ? List.of() : mapping.collections();
    }

    public Optional<MemoryLayer> getLayerForCollection(String collection) {
        return Optional.ofNullable(layerByCollection.get(collection));
    }

    public List<MemoryLayerMapping> getMappings() {
        return List.copyOf(mappings.values());
    }

    // ── Counts ───────────────────────────────────────────────────────────────

    /** Points across the layer's collections; missing collections count as 0. */
    public long getLayerVectorCount(MemoryLayer layer) {
        long total = 0;
        for (String collection : getCollectionsForLayer(layer)) {
            total += admin.getCollectionInfo(collection).map(CollectionInfo::pointsCount).orElse(0L);
        }
        return total;
    }

    public long getTotalMemoryVectors() {
        return admin.getMemoryStatistics().totalVectors();
    }

    // ── Maintenance ──────────────────────────────────────────────────────────

    /**
     * Runs the collection health check at the configured dimension. With
     * {@code autoHeal}, unhealthy collections are healed straight away: the
     * flag itself is the confirmation for the destructive rebuild.
     */
    public MemoryHealthReport performHealthCheck(boolean autoHeal) {
        List<CollectionHealthReport> reports = admin.healthCheck(props.defaultVectorSize());
        List<String> unhealthy = reports.stream()
                .filter(r -> !r.healthy())
                .map(CollectionHealthReport::collectionName)
                .toList();

        List<String> healed = autoHeal && !unhealthy.isEmpty()
                ? admin.autoHeal(props.defaultVectorSize(), true)
                : List.of();

        MemoryStatistics stats = admin.getMemoryStatistics();
        return new MemoryHealthReport(reports.size() - unhealthy.size(), unhealthy.size(), healed, unhealthy, stats);
    }

    /**
     * Drops and recreates, empty, every collection of the layer. Links touching
     * a recreated collection are put back, so clearing a layer empties its
     * vectors without changing the collection graph.
     *
     * @return false without confirmation, or when any collection of the layer did not exist
     */
    public boolean clearMemoryLayer(MemoryLayer layer, boolean confirmed) {
        if (!confirmed) {
            log.warn("[Memory] Clearing layer {} requested without confirmation, ignored.", layer);
            return false;
        }

        boolean success = true;
        for (String collection : getCollectionsForLayer(layer)) {
            List<CollectionLink> links = admin.getLinkedCollections(collection);
            if (admin.deleteCollection(collection)) {
                admin.createCollection(collection, props.defaultVectorSize(), Distance.COSINE,
                        CollectionAdmin.KNOWN_COLLECTIONS.get(collection));
                links.forEach(admin::addCollectionLink);
            } else {
                success = false;
            }
        }
        log.warn("[Memory] Cleared layer {} ({})", layer, success ? "complete" : "some collections were missing");
        return success;
    }

    public MemorySnapshot createSnapshot() {
        List<CollectionInfo> collections = admin.getAllCollections();
        MemoryStatistics stats = admin.getMemoryStatistics();

        Map<MemoryLayer, Long> layerCounts = new EnumMap<>(MemoryLayer.class);
        for (MemoryLayer layer : MemoryLayer.values()) {
            layerCounts.put(layer, getLayerVectorCount(layer));
        }
        return new MemorySnapshot(clock.instant(), collections, admin.getCollectionLinks(), layerCounts, stats);
    }

    // ── Links ────────────────────────────────────────────────────────────────

    public void linkCollections(String source, String target, CollectionLink.LinkType type,
                                @Nullable String description) {
        admin.addCollectionLink(new CollectionLink(source, target, type, 1.0, description));
    }

    public List<CollectionLink> getRelatedCollections(String collection) {
        return admin.getLinkedCollections(collection);
    }

    public String getMemoryMap() {
        return admin.generateMemoryMap();
    }

    static List<MemoryLayerMapping> applyOverrides(List<MemoryLayerMapping> defaults,
                                                   Map<String, List<String>> overrides) {
        if (overrides.isEmpty()) return defaults;

        Map<MemoryLayer, List<String>> byLayer = new EnumMap<>(MemoryLayer.class);
        overrides.forEach((name, collections) -> byLayer.put(MemoryLayer.parse(name), collections));

        List<MemoryLayerMapping> result = new ArrayList<>();
        for (MemoryLayerMapping mapping : defaults) {
            List<String> replacement = byLayer.get(mapping.layer());
            result.add(replacement == null ? mapping : mapping.withCollections(replacement));
        }
        return result;
    }
}
