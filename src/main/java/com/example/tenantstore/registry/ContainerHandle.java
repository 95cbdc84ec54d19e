package com.example.tenantstore.registry;

import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.query.QuerySpec;
import com.example.tenantstore.store.DocumentStore;
import com.example.tenantstore.store.QueryPage;

import java.util.Map;
import java.util.Optional;

/**
 * A resolved container for one entity family. Immutable and safe to share between threads.
 */
public final class ContainerHandle {

    private final EntityFamily family;
    private final DocumentStore store;

    ContainerHandle(EntityFamily family, DocumentStore store) {
        this.family = family;
        this.store = store;
    }

    public EntityFamily getFamily() {
        return family;
    }

    public String getContainer() {
        return family.getContainer();
    }

    public Map<String, Object> create(Map<String, Object> document, String partitionKey) {
        return store.create(getContainer(), document, partitionKey);
    }

    public Optional<Map<String, Object>> read(String id, String partitionKey) {
        return store.read(getContainer(), id, partitionKey);
    }

    public Map<String, Object> replace(Map<String, Object> document, String partitionKey, long expectedVersion) {
        return store.replace(getContainer(), document, partitionKey, expectedVersion);
    }

    public void delete(String id, String partitionKey) {
        store.delete(getContainer(), id, partitionKey);
    }

    public QueryPage<Map<String, Object>> query(QuerySpec spec) {
        return store.query(getContainer(), spec);
    }

    public long count(QuerySpec spec) {
        return store.count(getContainer(), spec);
    }
}
