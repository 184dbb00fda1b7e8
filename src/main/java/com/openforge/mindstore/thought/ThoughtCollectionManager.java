package com.openforge.mindstore.thought;

import com.openforge.mindstore.vector.Distance;
import com.openforge.mindstore.vector.VectorBackendClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily creates the thought, relation and result collections.
 *
 * A missing collection is not an error: it is created (empty, at the
 * configured vector size) the first time a store touches it. Known names are
 * cached to avoid a backend round-trip on every read and write.
 */
@Slf4j
@Component
public class ThoughtCollectionManager {

    private final VectorBackendClient    backend;
    private final ThoughtStoreProperties props;

    /** In-memory cache of collection names we know already exist. */
    private final Set<String> existingCollections = ConcurrentHashMap.newKeySet();

    public ThoughtCollectionManager(VectorBackendClient backend, ThoughtStoreProperties props) {
        this.backend = backend;
        this.props   = props;
    }

    /** Ensures all three collections exist. Backend failures propagate. */
    public void ensureAll() {
        for (String name : allCollections()) {
            ensureCollection(name);
        }
    }

    public void ensureCollection(String collectionName) {
        if (existingCollections.contains(collectionName)) return;

        if (backend.collectionExists(collectionName)) {
            existingCollections.add(collectionName);
            log.info("[Thoughts] Collection '{}' confirmed existing.", collectionName);
            return;
        }

        log.info("[Thoughts] Creating collection '{}' (dim={})…", collectionName, props.vectorSize());
        backend.createCollection(collectionName, props.vectorSize(), Distance.COSINE);
        existingCollections.add(collectionName);
    }

    /** Drops the cached entry so the next access re-checks the backend. */
    public void forget(String collectionName) {
        existingCollections.remove(collectionName);
    }

    public List<String> allCollections() {
        return List.of(props.thoughtsCollection(), props.relationsCollection(), props.resultsCollection());
    }
}
