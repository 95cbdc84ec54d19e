package com.example.tenantstore.repo;

import com.example.tenantstore.exception.ValidationException;
import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.model.DocumentRecord;
import com.example.tenantstore.model.DocumentStatus;
import com.example.tenantstore.query.QueryFilter;
import com.example.tenantstore.query.QueryRequest;
import com.example.tenantstore.retry.OperationContext;
import com.example.tenantstore.store.QueryPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class DocumentRepository extends HpkRepository<DocumentRecord> {

    private static final Logger logger = LoggerFactory.getLogger(DocumentRepository.class);

    public DocumentRepository(RepositorySupport support) {
        super(EntityFamily.DOCUMENT, DocumentRecord.class, support);
    }

    @Override
    protected String[] keyFieldsOf(DocumentRecord document) {
        return new String[] {document.getTenantId(), document.getProjectId(), document.getDocumentId()};
    }

    @Override
    protected void validate(DocumentRecord document) {
        require("Document", "fileName", document.getFileName());
        require("Document", "contentType", document.getContentType());
        if (document.getFileSize() != null && document.getFileSize() < 0) {
            throw new ValidationException("Document.fileSize must not be negative");
        }
        if (document.getStatus() == null) {
            document.setStatus(DocumentStatus.UPLOADED);
        }
    }

    @Override
    protected void checkUpdate(DocumentRecord stored, DocumentRecord updated) {
        DocumentStatus from = stored.getStatus();
        DocumentStatus to = updated.getStatus();
        if (from != null && from != to && !from.canTransitionTo(to)) {
            throw new ValidationException(String.format(
                    "Document %s cannot move from %s to %s", stored.getDocumentId(), from.getValue(), to.getValue()));
        }
    }

    /**
     * Moves a document through its processing state machine. Illegal transitions are rejected
     * before any write; concurrent status changes surface as version conflicts.
     */
    public DocumentRecord updateStatus(String tenantId, String projectId, String documentId,
                                       DocumentStatus next, String errorMessage) {
        return updateStatus(tenantId, projectId, documentId, next, errorMessage, OperationContext.none());
    }

    public DocumentRecord updateStatus(String tenantId, String projectId, String documentId,
                                       DocumentStatus next, String errorMessage, OperationContext context) {
        require("Document", "status", next);
        DocumentRecord current = requireExisting(context, false, tenantId, projectId, documentId);
        DocumentStatus from = current.getStatus();
        if (!from.canTransitionTo(next)) {
            throw new ValidationException(String.format(
                    "Document %s cannot move from %s to %s", documentId, from.getValue(), next.getValue()));
        }
        current.setStatus(next);
        current.setErrorMessage(next == DocumentStatus.FAILED ? errorMessage : null);
        if (next == DocumentStatus.COMPLETED || next == DocumentStatus.FAILED) {
            current.setProcessedAt(support.getClock().instant());
        }
        logger.debug("Document {} {} -> {}", documentId, from.getValue(), next.getValue());
        return update(current, current.getVersion(), context);
    }

    public QueryPage<DocumentRecord> listDocuments(String tenantId, String projectId, DocumentStatus status,
                                                   Integer pageSize, String continuationToken) {
        QueryRequest request = QueryRequest.forTenant(tenantId);
        request.setScopeValue(projectId);
        if (status != null) {
            request.getFilters().add(QueryFilter.eq("status", status.getValue()));
        }
        request.setPageSize(pageSize);
        request.setContinuationToken(continuationToken);
        return query(request);
    }
}
