package com.openforge.llmkit.vector;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link VectorDatabase} backed by Milvus, one collection per embedding backend.
 *
 * Collection schema ({prefix}_{backend}):
 * ┌──────────────┬──────────────────┬──────────────────────────────────────┐
 * │ Field        │ Type             │ Notes                                │
 * ├──────────────┼──────────────────┼──────────────────────────────────────┤
 * │ doc_id       │ VARCHAR(128) PK  │ caller-supplied, or doc-{uuid}       │
 * │ metadata     │ JSON             │ free-form; text lives under content  │
 * │ embedding    │ FLOAT_VECTOR     │ dim from vector.milvus.collections   │
 * └──────────────┴──────────────────┴──────────────────────────────────────┘
 *
 * Index: HNSW on embedding, metric = COSINE. Ollama embeddings are not
 * normalised, so inner product would skew the ranking.
 */
@Slf4j
public class MilvusVectorDatabase implements VectorDatabase {

    static final String FIELD_ID        = "doc_id";
    static final String FIELD_METADATA  = "metadata";
    static final String FIELD_EMBEDDING = "embedding";

    private static final Type METADATA_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

    /** May be null when Milvus was unreachable at startup. */
    @Nullable
    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;
    private final Gson             gson = new Gson();

    /** Collection names known to exist. */
    private final Set<String> existingCollections = ConcurrentHashMap.newKeySet();

    public MilvusVectorDatabase(@Nullable MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.props        = Objects.requireNonNull(props, "props must not be null");
        if (milvusClient == null) {
            log.warn("[Vector] MilvusClientV2 is not available, every vector store call will fail.");
        }
    }

    // ── VectorDatabase ───────────────────────────────────────────────────────

    @Override
    public String insertDocument(String content, List<Float> embedding) {
        String docId = "doc-" + UUID.randomUUID();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Document.CONTENT_KEY, content);
        saveEmbeddings(docId, embedding, metadata);
        return docId;
    }

    @Override
    public void saveEmbeddings(String docId, List<Float> embedding, Map<String, Object> metadata) {
        Objects.requireNonNull(docId, "docId must not be null");
        requireEmbedding(embedding);
        String selector   = selectorForDimension(embedding.size());
        String collection = props.collectionName(selector);
        MilvusClientV2 client = client();

        JsonObject row = new JsonObject();
        row.addProperty(FIELD_ID, docId);
        row.add(FIELD_METADATA, gson.toJsonTree(metadata == null ? Map.of() : metadata));
        JsonArray vector = new JsonArray();
        for (Float f : embedding) vector.add(f);
        row.add(FIELD_EMBEDDING, vector);

        try {
            ensureCollection(client, collection, embedding.size());
            client.upsert(UpsertReq.builder()
                    .collectionName(collection)
                    .data(List.of(row))
                    .build());
        } catch (RuntimeException e) {
            throw new VectorStoreException(
                    "Failed to save document '%s' to collection '%s'".formatted(docId, collection), e);
        }
        log.debug("[Vector] Saved document {} to {} (dim={})", docId, collection, embedding.size());
    }

    @Override
    public List<Document> queryRelevantDocuments(List<Float> embedding, String selector, QueryOptions options) {
        requireEmbedding(embedding);
        Integer dimension = selector == null ? null : props.collections().get(selector);
        if (dimension == null) {
            throw new VectorStoreException("Unknown embedding backend selector: " + selector);
        }
        if (dimension != embedding.size()) {
            throw new VectorStoreException("Embedding has %d dimensions, collection for '%s' expects %d"
                    .formatted(embedding.size(), selector, dimension));
        }
        int    limit      = (options == null ? QueryOptions.defaults() : options).limit();
        String collection = props.collectionName(selector);
        MilvusClientV2 client = client();

        SearchResp resp;
        try {
            ensureCollection(client, collection, dimension);
            resp = client.search(SearchReq.builder()
                    .collectionName(collection)
                    .data(List.of(new FloatVec(embedding)))
                    .annsField(FIELD_EMBEDDING)
                    .topK(limit)
                    .outputFields(List.of(FIELD_ID, FIELD_METADATA))
                    .build());
        } catch (RuntimeException e) {
            throw new VectorStoreException("Search in collection '%s' failed".formatted(collection), e);
        }

        List<Document> results = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return results;

        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                if (results.size() == limit) break;
                results.add(toDocument(hit));
            }
        }
        log.debug("[Vector] Query on {} returned {} document(s)", collection, results.size());
        return results;
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private MilvusClientV2 client() {
        if (milvusClient == null) {
            throw new VectorStoreException("Milvus is not connected");
        }
        return milvusClient;
    }

    private static void requireEmbedding(List<Float> embedding) {
        if (embedding == null || embedding.isEmpty()) {
            throw new VectorStoreException("Embedding must not be empty");
        }
    }

    private String selectorForDimension(int dimension) {
        for (Map.Entry<String, Integer> entry : props.collections().entrySet()) {
            if (entry.getValue() == dimension) {
                return entry.getKey();
            }
        }
        throw new VectorStoreException("Unsupported embedding dimension: " + dimension);
    }

    private void ensureCollection(MilvusClientV2 client, String name, int dimension) {
        if (existingCollections.contains(name)) return;

        boolean exists = Boolean.TRUE.equals(client.hasCollection(
                HasCollectionReq.builder().collectionName(name).build()));
        if (!exists) {
            log.info("[Vector] Creating collection '{}' (dim={})...", name, dimension);
            createCollection(client, name, dimension);
        }
        existingCollections.add(name);
    }

    private void createCollection(MilvusClientV2 client, String name, int dimension) {
        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder().fieldName(FIELD_ID)
                .dataType(DataType.VarChar).maxLength(128).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_METADATA)
                .dataType(DataType.JSON).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_EMBEDDING)
                .dataType(DataType.FloatVector).dimension(dimension).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(FIELD_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex))
                .build());

        log.info("[Vector] Collection '{}' created successfully.", name);
    }

    private Document toDocument(SearchResp.SearchResult hit) {
        Map<String, Object> entity = hit.getEntity() == null ? Map.of() : hit.getEntity();
        Object rawId = entity.getOrDefault(FIELD_ID, hit.getId());
        return new Document(rawId == null ? null : rawId.toString(), toMetadata(entity.get(FIELD_METADATA)));
    }

    private Map<String, Object> toMetadata(Object raw) {
        if (raw == null) return Map.of();
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            map.forEach((key, value) -> metadata.put(String.valueOf(key), value));
            return metadata;
        }
        if (raw instanceof JsonElement element) return gson.fromJson(element, METADATA_TYPE);
        if (raw instanceof String json) return gson.fromJson(json, METADATA_TYPE);
        throw new VectorStoreException("Unexpected metadata value of type " + raw.getClass().getName());
    }
}
