package com.openforge.mindstore.testsupport;

import com.openforge.mindstore.vector.CollectionDescription;
import com.openforge.mindstore.vector.CollectionStatus;
import com.openforge.mindstore.vector.Distance;
import com.openforge.mindstore.vector.PointFilter;
import com.openforge.mindstore.vector.ScoredPoint;
import com.openforge.mindstore.vector.ScrollPage;
import com.openforge.mindstore.vector.StoredPoint;
import com.openforge.mindstore.vector.VectorBackendClient;
import com.openforge.mindstore.vector.VectorBackendException;
import com.openforge.mindstore.vector.VectorPoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed {@link VectorBackendClient} for tests. Filters are evaluated
 * with the same must/should semantics the Milvus adapter renders; search
 * ranks by cosine similarity. Scrolls page by primary key, the way the
 * Milvus adapter does, and counts the pages served in {@link #scrollCalls()}. {@link #setAvailable(boolean)} simulates an
 * outage: every call then throws {@link VectorBackendException}.
 */
public class InMemoryVectorBackend implements VectorBackendClient {

    private final Map<String, Collection> collections = new TreeMap<>();
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicInteger scrollCalls = new AtomicInteger();

    private static final class Collection {
        int vectorSize;
        Distance distance;
        CollectionStatus status = CollectionStatus.GREEN;
        final Map<String, VectorPoint> points = new LinkedHashMap<>();

        Collection(int vectorSize, Distance distance) {
            this.vectorSize = vectorSize;
            this.distance = distance;
        }
    }

    public void setAvailable(boolean value) {
        available.set(value);
    }

    public void setStatus(String collection, CollectionStatus status) {
        require(collection).status = status;
    }

    /** Writes points without any dimension check, e.g. to seed a legacy collection. */
    public void seed(String collection, VectorPoint... points) {
        for (VectorPoint p : points) require(collection).points.put(p.id(), p);
    }

    public int scrollCalls() {
        return scrollCalls.get();
    }

    public int vectorSize(String collection) {
        return require(collection).vectorSize;
    }

    public int pointCount(String collection) {
        Collection c = collections.get(collection);
        return c == null ? 0 : c.points.size();
    }

    public Optional<VectorPoint> point(String collection, String id) {
        Collection c = collections.get(collection);
        return c == null ? Optional.empty() : Optional.ofNullable(c.points.get(id));
    }

    @Override
    public synchronized boolean collectionExists(String collection) {
        check();
        return collections.containsKey(collection);
    }

    @Override
    public synchronized void createCollection(String collection, int vectorSize, Distance distance) {
        check();
        collections.putIfAbsent(collection, new Collection(vectorSize, distance));
    }

    @Override
    public synchronized void deleteCollection(String collection) {
        check();
        collections.remove(collection);
    }

    @Override
    public synchronized Optional<CollectionDescription> describeCollection(String collection) {
        check();
        Collection c = collections.get(collection);
        if (c == null) return Optional.empty();
        return Optional.of(new CollectionDescription(collection, c.vectorSize, c.points.size(), c.distance, c.status));
    }

    @Override
    public synchronized List<String> listCollections() {
        check();
        return new ArrayList<>(collections.keySet());
    }

    @Override
    public synchronized void upsert(String collection, List<VectorPoint> points) {
        check();
        Collection c = collections.get(collection);
        if (c == null) throw new VectorBackendException("collection not found: " + collection);
        for (VectorPoint p : points) {
            if (p.vector().size() != c.vectorSize) {
                throw new VectorBackendException("dimension mismatch: expected " + c.vectorSize
                        + ", got " + p.vector().size());
            }
            c.points.put(p.id(), p);
        }
    }

    @Override
    public synchronized List<ScoredPoint> search(String collection, List<Float> vector, PointFilter filter,
                                                 int limit, Float scoreThreshold) {
        check();
        Collection c = collections.get(collection);
        if (c == null) throw new VectorBackendException("collection not found: " + collection);
        return c.points.values().stream()
                .filter(p -> matches(p.payload(), filter))
                .map(p -> new ScoredPoint(p.id(), cosine(vector, p.vector()), p.payload()))
                .filter(s -> scoreThreshold == null || s.score() >= scoreThreshold)
                .sorted(Comparator.comparingDouble(ScoredPoint::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized ScrollPage scroll(String collection, PointFilter filter, int limit, String cursor) {
        check();
        scrollCalls.incrementAndGet();
        Collection c = collections.get(collection);
        if (c == null) throw new VectorBackendException("collection not found: " + collection);
        List<StoredPoint> page = c.points.values().stream()
                .filter(p -> matches(p.payload(), filter))
                .filter(p -> cursor == null || p.id().compareTo(cursor) > 0)
                .sorted(Comparator.comparing(VectorPoint::id))
                .limit(limit)
                .map(p -> new StoredPoint(p.id(), p.payload()))
                .toList();
        String next = page.size() < limit || page.isEmpty() ? null : page.get(page.size() - 1).id();
        return new ScrollPage(page, next);
    }

    @Override
    public synchronized void delete(String collection, List<String> ids) {
        check();
        Collection c = collections.get(collection);
        if (c != null) ids.forEach(c.points::remove);
    }

    @Override
    public synchronized void delete(String collection, PointFilter filter) {
        check();
        Collection c = collections.get(collection);
        if (c != null) c.points.values().removeIf(p -> matches(p.payload(), filter));
    }

    @Override
    public synchronized long count(String collection, PointFilter filter) {
        check();
        Collection c = collections.get(collection);
        if (c == null) return 0;
        return c.points.values().stream().filter(p -> matches(p.payload(), filter)).count();
    }

    private Collection require(String collection) {
        Collection c = collections.get(collection);
        if (c == null) throw new IllegalStateException("no collection " + collection);
        return c;
    }

    private void check() {
        if (!available.get()) throw new VectorBackendException("backend unavailable");
    }

    private static boolean matches(Map<String, Object> payload, PointFilter filter) {
        if (filter == null) return true;
        for (PointFilter.Condition c : filter.must()) {
            if (!Objects.equals(String.valueOf(payload.get(c.key())), c.value())) return false;
        }
        if (filter.should().isEmpty()) return true;
        return filter.should().stream()
                .anyMatch(c -> Objects.equals(String.valueOf(payload.get(c.key())), c.value()));
    }

    private static double cosine(List<Float> a, List<Float> b) {
        if (a.size() != b.size()) return 0.0;
        double dot = 0, ma = 0, mb = 0;
        for (int i = 0; i < a.size(); i++) {
            dot += a.get(i) * b.get(i);
            ma += a.get(i) * a.get(i);
            mb += b.get(i) * b.get(i);
        }
        return ma == 0 || mb == 0 ? 0.0 : dot / (Math.sqrt(ma) * Math.sqrt(mb));
    }
}
