package com.openforge.mindstore.layer;

import com.openforge.mindstore.admin.AdminProperties;
import com.openforge.mindstore.admin.CollectionAdmin;
import com.openforge.mindstore.admin.CollectionLink;
import com.openforge.mindstore.testsupport.InMemoryVectorBackend;
import com.openforge.mindstore.testsupport.MemoryHarness;
import com.openforge.mindstore.thought.ThoughtCollectionManager;
import com.openforge.mindstore.thought.ThoughtStoreProperties;
import com.openforge.mindstore.vector.Distance;
import com.openforge.mindstore.vector.VectorPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryLayerManagerTest {

    private InMemoryVectorBackend backend;
    private CollectionAdmin admin;
    private MemoryLayerManager manager;

    @BeforeEach
    void setUp() {
        backend = new InMemoryVectorBackend();
        admin = new CollectionAdmin(backend, AdminProperties.defaults(),
                new ThoughtCollectionManager(backend, ThoughtStoreProperties.defaults()));
        manager = new MemoryLayerManager(admin, AdminProperties.defaults(), MemoryHarness.CLOCK);
    }

    private void seed(String collection, int points) {
        for (int i = 0; i < points; i++) {
            backend.seed(collection, new VectorPoint(collection + i, Collections.nCopies(768, 0.1f), Map.of()));
        }
    }

    // ==================== Mapping ====================

    @Test
    void shouldResolveDefaultMapping() {
        assertEquals(List.of("mindstore_neuro_thoughts"), manager.getCollectionsForLayer(MemoryLayer.WORKING));
        assertEquals(MemoryLayer.PROCEDURAL, manager.getLayerForCollection("tools").orElseThrow());
        assertEquals(MemoryLayer.SEMANTIC, manager.getLayerForCollection("core").orElseThrow());
        assertTrue(manager.getLayerForCollection("prefix_cache").isEmpty());
        assertEquals(5, manager.getMappings().size());
    }

    @Test
    void shouldRejectCollectionInTwoLayers() {
        List<MemoryLayerMapping> overlapping = List.of(
                new MemoryLayerMapping(MemoryLayer.WORKING, List.of("shared"), "w", 1.0),
                new MemoryLayerMapping(MemoryLayer.EPISODIC, List.of("shared", "other"), "e", 0.9));

        assertThrows(IllegalArgumentException.class,
                () -> new MemoryLayerManager(admin, AdminProperties.defaults(), MemoryHarness.CLOCK, overlapping));
    }

    @Test
    void shouldRejectRetentionPriorityOutOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new MemoryLayerMapping(MemoryLayer.WORKING, List.of("a"), "w", 1.5));
    }

    @Test
    void shouldApplyConfiguredOverrides() {
        AdminProperties props = new AdminProperties(768, Map.of("semantic", List.of("wiki")));
        MemoryLayerManager custom = new MemoryLayerManager(admin, props, MemoryHarness.CLOCK);

        assertEquals(List.of("wiki"), custom.getCollectionsForLayer(MemoryLayer.SEMANTIC));
        assertTrue(custom.getLayerForCollection("core").isEmpty());
        assertEquals(List.of("mindstore_neuro_thoughts"), custom.getCollectionsForLayer(MemoryLayer.WORKING));
    }

    @Test
    void shouldRejectUnknownLayerInOverrides() {
        assertThrows(IllegalArgumentException.class, () -> MemoryLayerManager.applyOverrides(
                MemoryLayerManager.DEFAULT_MAPPINGS, Map.of("dreaming", List.of("x"))));
    }

    // ==================== Initialize ====================

    @Test
    void shouldCreateEveryMappedCollectionOnInitialize() {
        admin.createCollection("core", 1536, Distance.COSINE, null);

        manager.initialize();

        for (MemoryLayerMapping mapping : manager.getMappings()) {
            for (String collection : mapping.collections()) {
                assertTrue(backend.collectionExists(collection), collection);
            }
        }
        assertEquals(1536, backend.vectorSize("core"));
        assertEquals(768, backend.vectorSize("mindstore_skills"));
        assertFalse(admin.getCollectionLinks().isEmpty());
    }

    // ==================== Counts ====================

    @Test
    void shouldCountVectorsPerLayer() {
        manager.initialize();
        seed("mindstore_conversations", 3);
        seed("mindstore_thought_results", 2);
        seed("core", 4);

        assertEquals(5, manager.getLayerVectorCount(MemoryLayer.EPISODIC));
        assertEquals(4, manager.getLayerVectorCount(MemoryLayer.SEMANTIC));
        assertEquals(0, manager.getLayerVectorCount(MemoryLayer.WORKING));
        assertEquals(9, manager.getTotalMemoryVectors());
    }

    @Test
    void shouldCountMissingCollectionsAsZero() {
        assertEquals(0, manager.getLayerVectorCount(MemoryLayer.AUTOBIOGRAPHICAL));
    }

    // ==================== Clear ====================

    @Test
    void shouldNotClearWithoutConfirmation() {
        manager.initialize();
        seed("mindstore_skills", 2);

        assertFalse(manager.clearMemoryLayer(MemoryLayer.PROCEDURAL, false));
        assertEquals(2, backend.pointCount("mindstore_skills"));
    }

    @Test
    void shouldRecreateLayerCollectionsEmpty() {
        manager.initialize();
        seed("mindstore_skills", 2);
        seed("tools", 1);
        seed("core", 3);

        assertTrue(manager.clearMemoryLayer(MemoryLayer.PROCEDURAL, true));

        assertTrue(backend.collectionExists("mindstore_skills"));
        assertEquals(0, backend.pointCount("mindstore_skills"));
        assertEquals(0, backend.pointCount("tools"));
        assertEquals(3, backend.pointCount("core"));
        assertEquals("Learned skills and capabilities",
                admin.getCollectionInfo("mindstore_skills").orElseThrow().purpose());
    }

    @Test
    void shouldReportPartialClearWhenCollectionMissing() {
        admin.createCollection("mindstore_skills");

        assertFalse(manager.clearMemoryLayer(MemoryLayer.PROCEDURAL, true));
        assertTrue(backend.collectionExists("mindstore_skills"));
        assertFalse(backend.collectionExists("tools"));
    }

    @Test
    void shouldKeepCollectionLinksWhenClearingLayer() {
        manager.initialize();
        manager.linkCollections("mindstore_neuro_thoughts", "codebase", CollectionLink.LinkType.RELATED_TO, "code cited");
        List<CollectionLink> before = admin.getCollectionLinks();
        seed("mindstore_neuro_thoughts", 2);

        assertTrue(manager.clearMemoryLayer(MemoryLayer.WORKING, true));

        assertEquals(0, backend.pointCount("mindstore_neuro_thoughts"));
        assertEquals(CollectionAdmin.DEFAULT_LINKS.size() + 1, admin.getCollectionLinks().size());
        assertTrue(admin.getCollectionLinks().containsAll(before));
        assertEquals(CollectionAdmin.DEFAULT_LINKS.size() + 1, manager.createSnapshot().links().size());
    }

    @Test
    void shouldKeepLinksBetweenCollectionsOfSameLayer() {
        manager.initialize();
        int linksBefore = admin.getCollectionLinks().size();
        manager.linkCollections("mindstore_conversations", "mindstore_thought_results",
                CollectionLink.LinkType.MIRRORS, "same episode");

        assertTrue(manager.clearMemoryLayer(MemoryLayer.EPISODIC, true));

        assertEquals(linksBefore + 1, admin.getCollectionLinks().size());
        assertEquals(1, admin.getLinkedCollections("mindstore_conversations").stream()
                .filter(l -> l.touches("mindstore_thought_results")).count());
    }

    // ==================== Health ====================

    @Test
    void shouldReportWithoutHealing() {
        manager.initialize();
        admin.deleteCollection("core");
        admin.createCollection("core", 1536, Distance.COSINE, null);

        MemoryHealthReport report = manager.performHealthCheck(false);

        assertEquals(List.of("core"), report.unhealthyCollectionNames());
        assertEquals(1, report.unhealthyCollections());
        assertTrue(report.healedCollections().isEmpty());
        assertEquals(1536, backend.vectorSize("core"));
    }

    @Test
    void shouldHealWhenRequested() {
        manager.initialize();
        admin.deleteCollection("core");
        admin.createCollection("core", 1536, Distance.COSINE, null);

        MemoryHealthReport report = manager.performHealthCheck(true);

        assertEquals(List.of("core"), report.healedCollections());
        assertEquals(768, backend.vectorSize("core"));
        assertEquals(report.healthyCollections() + 1, report.statistics().totalCollections());
    }

    // ==================== Snapshot & links ====================

    @Test
    void shouldSnapshotLayersAndLinks() {
        manager.initialize();
        seed("mindstore_neuro_thoughts", 2);

        MemorySnapshot snapshot = manager.createSnapshot();

        assertEquals(MemoryHarness.CLOCK.instant(), snapshot.timestamp());
        assertEquals(2L, snapshot.layerVectorCounts().get(MemoryLayer.WORKING));
        assertEquals(MemoryLayer.values().length, snapshot.layerVectorCounts().size());
        assertEquals(CollectionAdmin.DEFAULT_LINKS.size(), snapshot.links().size());
        assertEquals(snapshot.collections().size(), snapshot.statistics().totalCollections());
    }

    @Test
    void shouldLinkCollectionsThroughAdmin() {
        manager.linkCollections("documentation", "codebase", CollectionLink.LinkType.MIRRORS, "docs mirror code");

        List<CollectionLink> related = manager.getRelatedCollections("codebase");
        assertEquals(1, related.size());
        assertEquals(1.0, related.get(0).strength());
        assertEquals("docs mirror code", related.get(0).description());
        assertTrue(manager.getMemoryMap().contains("mirrors"));
    }
}
