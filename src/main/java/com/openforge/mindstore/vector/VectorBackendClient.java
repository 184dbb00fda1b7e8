package com.openforge.mindstore.vector;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Port to the remote vector-search backend.
 *
 * All calls are blocking round-trips. Implementations raise
 * {@link VectorBackendException} when the backend cannot serve the request;
 * they never retry.
 */
public interface VectorBackendClient {

    boolean collectionExists(String collection);

    void createCollection(String collection, int vectorSize, Distance distance);

    void deleteCollection(String collection);

    /** Empty when the collection does not exist. */
    Optional<CollectionDescription> describeCollection(String collection);

    List<String> listCollections();

    /** Insert-or-replace by point id. */
    void upsert(String collection, List<VectorPoint> points);

    /**
     * Nearest-neighbour search.
     *
     * @param filter         payload filter, null for none
     * @param scoreThreshold hits scoring below this are dropped, null for none
     */
    List<ScoredPoint> search(String collection,
                             List<Float> vector,
                             @Nullable PointFilter filter,
                             int limit,
                             @Nullable Float scoreThreshold);

    /**
     * Pages through points matching the filter.
     *
     * @param cursor value of {@link ScrollPage#nextCursor()} from the previous page, null for the first
     */
    ScrollPage scroll(String collection, @Nullable PointFilter filter, int limit, @Nullable String cursor);

    void delete(String collection, List<String> ids);

    void delete(String collection, PointFilter filter);

    long count(String collection, @Nullable PointFilter filter);
}
