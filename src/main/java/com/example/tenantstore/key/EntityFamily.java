package com.example.tenantstore.key;

import java.util.List;

/**
 * Entity families and their fixed partition key shape. The order and count of
 * {@link #getKeyFields()} must never change once data has been written.
 */
public enum EntityFamily {

    PROJECT("projects", "proj", "projectId", List.of("tenantId", "projectId", "entityType")),
    DOCUMENT("documents", "doc", "documentId", List.of("tenantId", "projectId", "documentId")),
    CHAT_SESSION("chats", "chat", "sessionId", List.of("tenantId", "userId", "sessionId")),
    EMBEDDING("embeddings", "emb", "chunkId", List.of("tenantId", "projectId", "chunkId")),
    KNOWLEDGE_ARTICLE("knowledge", "kb", "articleId", List.of("tenantId", "articleId"));

    private final String container;
    private final String tag;
    private final String idField;
    private final List<String> keyFields;

    EntityFamily(String container, String tag, String idField, List<String> keyFields) {
        this.container = container;
        this.tag = tag;
        this.idField = idField;
        this.keyFields = keyFields;
    }

    public String getContainer() {
        return container;
    }

    public String getTag() {
        return tag;
    }

    /** Key field whose value doubles as the document id within the partition. */
    public String getIdField() {
        return idField;
    }

    public List<String> getKeyFields() {
        return keyFields;
    }

    public int arity() {
        return keyFields.size();
    }

    /**
     * Fields the query builder treats as partition scope: the tenant plus the
     * second-level field.
     */
    public List<String> getScopeFields() {
        return keyFields.subList(0, Math.min(2, keyFields.size()));
    }

    public boolean isKeyField(String field) {
        return keyFields.contains(field);
    }
}
