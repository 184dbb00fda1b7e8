package com.openforge.mindstore.vector;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.DescribeCollectionReq;
import io.milvus.v2.service.collection.request.DropCollectionReq;
import io.milvus.v2.service.collection.request.GetCollectionStatsReq;
import io.milvus.v2.service.collection.request.GetLoadStateReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.collection.response.DescribeCollectionResp;
import io.milvus.v2.service.index.request.DescribeIndexReq;
import io.milvus.v2.service.index.response.DescribeIndexResp;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.QueryResp;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Milvus v2 adapter of {@link VectorBackendClient}.
 *
 * Collection layout (every collection this engine creates):
 * ┌──────────────┬─────────────────┬──────────────────────────────────────┐
 * │ Field        │ Type            │ Notes                                │
 * ├──────────────┼─────────────────┼──────────────────────────────────────┤
 * │ id           │ VARCHAR(64) PK  │ caller-assigned UUID, auto_id=false  │
 * │ embedding    │ FLOAT_VECTOR    │ dim = collection vector size         │
 * │ (dynamic)    │ JSON            │ payload fields, filterable by name   │
 * └──────────────┴─────────────────┴──────────────────────────────────────┘
 *
 * Payload fields live in the dynamic field so the three point schemas
 * (thought / relation / result) share one physical layout.
 */
@Slf4j
@Component
public class MilvusVectorBackendClient implements VectorBackendClient {

    static final String ID_FIELD     = "id";
    static final String VECTOR_FIELD = "embedding";

    private static final List<String> ALL_OUTPUT = List.of("*");

    /** May be null when mindstore.milvus.enabled=false or Milvus is unreachable. */
    @Nullable
    private final MilvusClientV2 milvusClient;

    public MilvusVectorBackendClient(@Nullable MilvusClientV2 milvusClient) {
        this.milvusClient = milvusClient;
        if (milvusClient == null) {
            log.warn("[Milvus] MilvusClientV2 is not available; every backend call will fail.");
        }
    }

    // ── Collection lifecycle ─────────────────────────────────────────────────

    @Override
    public boolean collectionExists(String collection) {
        return call("hasCollection " + collection, () -> client().hasCollection(
                HasCollectionReq.builder().collectionName(collection).build()));
    }

    @Override
    public void createCollection(String collection, int vectorSize, Distance distance) {
        log.info("[Milvus] Creating collection '{}' (dim={}, metric={})", collection, vectorSize, distance);

        CreateCollectionReq.CollectionSchema schema = CreateCollectionReq.CollectionSchema.builder()
                .enableDynamicField(true)
                .build();
        schema.addField(AddFieldReq.builder().fieldName(ID_FIELD)
                .dataType(DataType.VarChar).maxLength(64).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName(VECTOR_FIELD)
                .dataType(DataType.FloatVector).dimension(vectorSize).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(VECTOR_FIELD)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(toMetric(distance))
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        run("createCollection " + collection, () -> client().createCollection(CreateCollectionReq.builder()
                .collectionName(collection)
                .collectionSchema(schema)
                .enableDynamicField(true)
                .indexParams(List.of(vectorIndex))
                .build()));
    }

    @Override
    public void deleteCollection(String collection) {
        log.info("[Milvus] Dropping collection '{}'", collection);
        run("dropCollection " + collection, () -> client().dropCollection(
                DropCollectionReq.builder().collectionName(collection).build()));
    }

    @Override
    public Optional<CollectionDescription> describeCollection(String collection) {
        if (!collectionExists(collection)) return Optional.empty();

        DescribeCollectionResp resp = call("describeCollection " + collection, () -> client().describeCollection(
                DescribeCollectionReq.builder().collectionName(collection).build()));

        int vectorSize = 0;
        String vectorField = VECTOR_FIELD;
        if (resp.getCollectionSchema() != null) {
            for (CreateCollectionReq.FieldSchema field : resp.getCollectionSchema().getFieldSchemaList()) {
                if (field.getDataType() == DataType.FloatVector) {
                    vectorField = field.getName();
                    vectorSize  = field.getDimension() == null ? 0 : field.getDimension();
                    break;
                }
            }
        }

        Long rows = call("getCollectionStats " + collection, () -> client().getCollectionStats(
                GetCollectionStatsReq.builder().collectionName(collection).build()).getNumOfEntities());
        Boolean loaded = call("getLoadState " + collection, () -> client().getLoadState(
                GetLoadStateReq.builder().collectionName(collection).build()));

        return Optional.of(new CollectionDescription(
                collection,
                vectorSize,
                rows == null ? 0L : rows,
                metricOf(collection, vectorField),
                Boolean.TRUE.equals(loaded) ? CollectionStatus.GREEN : CollectionStatus.YELLOW));
    }

    @Override
    public List<String> listCollections() {
        return call("listCollections", () -> client().listCollections().getCollectionNames());
    }

    // ── Points ───────────────────────────────────────────────────────────────

    @Override
    public void upsert(String collection, List<VectorPoint> points) {
        if (points.isEmpty()) return;
        List<JsonObject> rows = new ArrayList<>(points.size());
        for (VectorPoint p : points) {
            rows.add(toRow(p));
        }
        run("upsert " + collection, () -> client().upsert(UpsertReq.builder()
                .collectionName(collection)
                .data(rows)
                .build()));
        log.debug("[Milvus] Upserted {} point(s) into '{}'", rows.size(), collection);
    }

    @Override
    public List<ScoredPoint> search(String collection,
                                    List<Float> vector,
                                    @Nullable PointFilter filter,
                                    int limit,
                                    @Nullable Float scoreThreshold) {
        SearchReq.SearchReqBuilder builder = SearchReq.builder()
                .collectionName(collection)
                .data(List.of(new FloatVec(vector)))
                .annsField(VECTOR_FIELD)
                .topK(limit)
                .outputFields(ALL_OUTPUT);

        String expr = MilvusFilterExpressions.render(filter);
        if (expr != null) builder.filter(expr);

        SearchResp resp = call("search " + collection, () -> client().search(builder.build()));

        List<ScoredPoint> results = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return results;

        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                Float s = hit.getScore();
                double score = s == null ? 0.0 : s.doubleValue();
                if (scoreThreshold != null && score < scoreThreshold) continue;
                results.add(new ScoredPoint(String.valueOf(hit.getId()), score, payloadOf(hit.getEntity())));
            }
        }
        return results;
    }

    /**
     * Keyset paging on the primary key: the cursor is the largest id of the
     * previous page and the next query asks for {@code id > cursor}. Milvus
     * returns limited query results in primary-key order and caps
     * offset + limit at 16384, so no offset is ever sent.
     */
    @Override
    public ScrollPage scroll(String collection, @Nullable PointFilter filter, int limit, @Nullable String cursor) {
        String expr = MilvusFilterExpressions.renderAfter(filter, ID_FIELD, cursor);

        QueryResp resp = call("query " + collection, () -> client().query(QueryReq.builder()
                .collectionName(collection)
                .filter(expr)
                .outputFields(ALL_OUTPUT)
                .limit(limit)
                .build()));

        if (resp == null || resp.getQueryResults() == null) return ScrollPage.empty();

        List<StoredPoint> points = new ArrayList<>();
        for (QueryResp.QueryResult r : resp.getQueryResults()) {
            Map<String, Object> entity = r.getEntity();
            points.add(new StoredPoint(String.valueOf(entity.get(ID_FIELD)), payloadOf(entity)));
        }
        return new ScrollPage(points, MilvusFilterExpressions.nextCursor(points, limit));
    }

    @Override
    public void delete(String collection, List<String> ids) {
        if (ids.isEmpty()) return;
        run("delete " + collection, () -> client().delete(DeleteReq.builder()
                .collectionName(collection)
                .ids(new ArrayList<>(ids))
                .build()));
    }

    @Override
    public void delete(String collection, PointFilter filter) {
        run("delete " + collection, () -> client().delete(DeleteReq.builder()
                .collectionName(collection)
                .filter(MilvusFilterExpressions.renderOrMatchAll(filter))
                .build()));
    }

    /**
     * Uses a COUNT expression query, no data transfer.
     */
    @Override
    public long count(String collection, @Nullable PointFilter filter) {
        QueryReq.QueryReqBuilder builder = QueryReq.builder()
                .collectionName(collection)
                .outputFields(List.of("count(*)"));
        String expr = MilvusFilterExpressions.render(filter);
        if (expr != null) builder.filter(expr);

        QueryResp resp = call("count " + collection, () -> client().query(builder.build()));
        if (resp == null || resp.getQueryResults().isEmpty()) return 0L;

        Object count = resp.getQueryResults().get(0).getEntity().get("count(*)");
        return count instanceof Number n ? n.longValue() : 0L;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private MilvusClientV2 client() {
        if (milvusClient == null) {
            throw new VectorBackendException("Milvus is not connected");
        }
        return milvusClient;
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (VectorBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new VectorBackendException("Milvus %s failed: %s".formatted(operation, e.getMessage()), e);
        }
    }

    private void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private Distance metricOf(String collection, String vectorField) {
        try {
            DescribeIndexResp resp = client().describeIndex(DescribeIndexReq.builder()
                    .collectionName(collection)
                    .fieldName(vectorField)
                    .build());
            for (DescribeIndexResp.IndexDesc desc : resp.getIndexDescriptions()) {
                if (desc.getMetricType() != null) return fromMetric(desc.getMetricType());
            }
        } catch (RuntimeException e) {
            log.debug("[Milvus] No index description for '{}', assuming COSINE: {}", collection, e.getMessage());
        }
        return Distance.COSINE;
    }

    private static JsonObject toRow(VectorPoint point) {
        JsonObject row = new JsonObject();
        point.payload().forEach((key, value) -> {
            if (value instanceof String s)        row.addProperty(key, s);
            else if (value instanceof Number n)   row.addProperty(key, n);
            else if (value instanceof Boolean b)  row.addProperty(key, b);
            else if (value != null)               row.addProperty(key, value.toString());
        });
        row.addProperty(ID_FIELD, point.id());

        JsonArray embedding = new JsonArray();
        for (Float f : point.vector()) embedding.add(f);
        row.add(VECTOR_FIELD, embedding);
        return row;
    }

    private static Map<String, Object> payloadOf(Map<String, Object> entity) {
        Map<String, Object> payload = new LinkedHashMap<>(entity);
        payload.remove(VECTOR_FIELD);
        return payload;
    }

    static IndexParam.MetricType toMetric(Distance distance) {
        return switch (distance) {
            case COSINE -> IndexParam.MetricType.COSINE;
            case DOT    -> IndexParam.MetricType.IP;
            case EUCLID -> IndexParam.MetricType.L2;
        };
    }

    static Distance fromMetric(IndexParam.MetricType metric) {
        return switch (metric) {
            case IP -> Distance.DOT;
            case L2 -> Distance.EUCLID;
            default -> Distance.COSINE;
        };
    }
}
