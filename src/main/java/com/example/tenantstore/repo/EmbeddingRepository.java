package com.example.tenantstore.repo;

import com.example.tenantstore.exception.ValidationException;
import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.model.EmbeddingChunk;
import com.example.tenantstore.query.QueryFilter;
import com.example.tenantstore.query.QueryRequest;
import com.example.tenantstore.query.SortOrder;
import com.example.tenantstore.store.QueryPage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

@Repository
public class EmbeddingRepository extends HpkRepository<EmbeddingChunk> {

    private final int dimensions;

    public EmbeddingRepository(RepositorySupport support, @Value("${app.embedding.dimensions:1536}") int dimensions) {
        super(EntityFamily.EMBEDDING, EmbeddingChunk.class, support);
        this.dimensions = dimensions;
    }

    @Override
    protected String[] keyFieldsOf(EmbeddingChunk chunk) {
        return new String[] {chunk.getTenantId(), chunk.getProjectId(), chunk.getChunkId()};
    }

    @Override
    protected void validate(EmbeddingChunk chunk) {
        require("Embedding", "documentId", chunk.getDocumentId());
        require("Embedding", "text", chunk.getText());
        require("Embedding", "vector", chunk.getVector());
        if (chunk.getVector().length != dimensions) {
            throw new ValidationException(String.format(
                    "Embedding vector has %d dimensions, expected %d", chunk.getVector().length, dimensions));
        }
        for (float v : chunk.getVector()) {
            if (Float.isNaN(v) || Float.isInfinite(v)) {
                throw new ValidationException("Embedding vector contains a non-finite value");
            }
        }
    }

    public int getDimensions() {
        return dimensions;
    }

    /** Chunks of one document in reading order. */
    public QueryPage<EmbeddingChunk> listChunks(String tenantId, String projectId, String documentId,
                                                Integer pageSize, String continuationToken) {
        QueryRequest request = QueryRequest.builder()
                .tenantId(tenantId)
                .scopeValue(projectId)
                .sort(SortOrder.asc("chunkIndex"))
                .pageSize(pageSize)
                .continuationToken(continuationToken)
                .build();
        request.getFilters().add(QueryFilter.eq("documentId", documentId));
        return query(request);
    }
}
