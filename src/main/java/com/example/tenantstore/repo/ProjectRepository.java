package com.example.tenantstore.repo;

import com.example.tenantstore.exception.ValidationException;
import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.model.Project;
import com.example.tenantstore.model.ProjectStatus;
import com.example.tenantstore.model.RagConfiguration;
import com.example.tenantstore.model.SecurityClassification;
import com.example.tenantstore.query.QueryFilter;
import com.example.tenantstore.query.QueryRequest;
import com.example.tenantstore.store.QueryPage;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class ProjectRepository extends HpkRepository<Project> {

    public ProjectRepository(RepositorySupport support) {
        super(EntityFamily.PROJECT, Project.class, support);
    }

    @Override
    protected String[] keyFieldsOf(Project project) {
        return new String[] {project.getTenantId(), project.getProjectId(), project.getEntityType()};
    }

    @Override
    protected void validate(Project project) {
        require("Project", "name", project.getName());
        require("Project", "owner", project.getOwner());
        if (project.getEntityType() == null) {
            project.setEntityType(Project.METADATA);
        }
        if (!Project.ENTITY_TYPES.contains(project.getEntityType())) {
            throw new ValidationException("Unknown project entityType: " + project.getEntityType());
        }
        if (project.getStatus() == null) {
            project.setStatus(ProjectStatus.ACTIVE);
        }
        if (project.getClassification() == null) {
            project.setClassification(SecurityClassification.INTERNAL);
        }
        if (project.getRagConfiguration() == null) {
            project.setRagConfiguration(RagConfiguration.defaults());
        }
        RagConfiguration rag = project.getRagConfiguration();
        if (rag.getRetrievalTopK() != null && rag.getRetrievalTopK() < 1) {
            throw new ValidationException("ragConfiguration.retrievalTopK must be positive");
        }
        if (rag.getChunkSize() != null && rag.getChunkOverlap() != null && rag.getChunkOverlap() >= rag.getChunkSize()) {
            throw new ValidationException("ragConfiguration.chunkOverlap must be smaller than chunkSize");
        }
    }

    public Optional<Project> findProject(String tenantId, String projectId) {
        return get(tenantId, projectId, Project.METADATA);
    }

    /**
     * Lists a tenant's project records, newest first, optionally restricted to one status.
     */
    public QueryPage<Project> listProjects(String tenantId, ProjectStatus status, Integer pageSize, String continuationToken) {
        QueryRequest request = QueryRequest.forTenant(tenantId);
        request.getFilters().add(QueryFilter.eq("entityType", Project.METADATA));
        if (status != null) {
            request.getFilters().add(QueryFilter.eq("status", status.getValue()));
        }
        request.setPageSize(pageSize);
        request.setContinuationToken(continuationToken);
        return query(request);
    }
}
