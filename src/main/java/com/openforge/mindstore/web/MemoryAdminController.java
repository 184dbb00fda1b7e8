package com.openforge.mindstore.web;

import com.openforge.mindstore.admin.AdminProperties;
import com.openforge.mindstore.admin.CollectionAdmin;
import com.openforge.mindstore.admin.CollectionHealthReport;
import com.openforge.mindstore.admin.CollectionInfo;
import com.openforge.mindstore.admin.MemoryStatistics;
import com.openforge.mindstore.layer.MemoryLayer;
import com.openforge.mindstore.layer.MemoryLayerManager;
import com.openforge.mindstore.layer.MemorySnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for operators: collection health, healing and memory layers.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                       Description          │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  GET    /api/memory/collections                 every collection     │
 * │  GET    /api/memory/stats                       aggregate counts     │
 * │  GET    /api/memory/health?dimension=768        dimension check      │
 * │  POST   /api/memory/heal?dimension=&confirm=    rebuild mismatched   │
 * │  GET    /api/memory/map                         boxed text map       │
 * │  GET    /api/memory/snapshot                    metadata snapshot    │
 * │  GET    /api/memory/layers                      layer → collections  │
 * │  DELETE /api/memory/layers/{layer}?confirm=     empty one layer      │
 * └──────────────────────────────────────────────────────────────────────┘
 *
 * Destructive endpoints do nothing unless {@code confirm=true}.
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
public class MemoryAdminController {

    private final CollectionAdmin    admin;
    private final MemoryLayerManager layerManager;
    private final AdminProperties    props;

    @GetMapping("/collections")
    public ResponseEntity<List<CollectionInfo>> collections() {
        return ResponseEntity.ok(admin.getAllCollections());
    }

    @GetMapping("/stats")
    public ResponseEntity<MemoryStatistics> stats() {
        return ResponseEntity.ok(admin.getMemoryStatistics());
    }

    @GetMapping("/health")
    public ResponseEntity<List<CollectionHealthReport>> health(
            @RequestParam(required = false) Integer dimension) {
        return ResponseEntity.ok(admin.healthCheck(dimensionOrDefault(dimension)));
    }

    @PostMapping("/heal")
    public ResponseEntity<HealResponse> heal(
            @RequestParam(required = false) Integer dimension,
            @RequestParam(defaultValue = "false") boolean confirm) {
        int target = dimensionOrDefault(dimension);
        return ResponseEntity.ok(new HealResponse(target, confirm, admin.autoHeal(target, confirm)));
    }

    @GetMapping(value = "/map", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> map() {
        return ResponseEntity.ok(layerManager.getMemoryMap());
    }

    @GetMapping("/snapshot")
    public ResponseEntity<MemorySnapshot> snapshot() {
        return ResponseEntity.ok(layerManager.createSnapshot());
    }

    @GetMapping("/layers")
    public ResponseEntity<List<LayerView>> layers() {
        List<LayerView> views = layerManager.getMappings().stream()
                .map(m -> new LayerView(m.layer(), m.collections(), m.description(), m.retentionPriority(),
                        layerManager.getLayerVectorCount(m.layer())))
                .toList();
        return ResponseEntity.ok(views);
    }

    @DeleteMapping("/layers/{layer}")
    public ResponseEntity<LayerClearResponse> clearLayer(
            @PathVariable String layer,
            @RequestParam(defaultValue = "false") boolean confirm) {
        MemoryLayer memoryLayer = MemoryLayer.parse(layer);
        boolean cleared = layerManager.clearMemoryLayer(memoryLayer, confirm);
        return ResponseEntity.ok(new LayerClearResponse(memoryLayer, confirm, cleared));
    }

    private int dimensionOrDefault(Integer dimension) {
        if (dimension == null) return props.defaultVectorSize();
        if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive, got " + dimension);
        return dimension;
    }

    // ── Inner DTOs ───────────────────────────────────────────────────────────

    public record HealResponse(int targetDimension, boolean confirmed, List<String> healed) {}

    public record LayerView(MemoryLayer layer, List<String> collections, String description,
                            double retentionPriority, long vectorCount) {}

    public record LayerClearResponse(MemoryLayer layer, boolean confirmed, boolean cleared) {}
}
