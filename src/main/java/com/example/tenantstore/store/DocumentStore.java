package com.example.tenantstore.store;

import com.example.tenantstore.query.QuerySpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Data plane of the document database. Documents are addressed by {@code (id, partitionKey)};
 * failures are reported as {@link StoreException} with an HTTP-like status code.
 */
public interface DocumentStore {

    String ID = "id";
    String PARTITION_KEY = "partitionKey";
    String VERSION = "version";

    Map<String, Object> create(String container, Map<String, Object> document, String partitionKey);

    Optional<Map<String, Object>> read(String container, String id, String partitionKey);

    /**
     * Replaces the stored document only if its {@code version} equals {@code expectedVersion}.
     * Fails with 412 when the version moved on and 404 when the document is gone.
     */
    Map<String, Object> replace(String container, Map<String, Object> document, String partitionKey, long expectedVersion);

    void delete(String container, String id, String partitionKey);

    QueryPage<Map<String, Object>> query(String container, QuerySpec spec);

    /** Counts documents matching the spec's predicates; sort and paging are ignored. */
    long count(String container, QuerySpec spec);

    /** Creates the container if needed and indexes the given partition-scoping fields. */
    void resolveContainer(String container, List<String> indexedFields);

    /** Lightweight round-trip used by health checks. */
    void ping(String container);
}
