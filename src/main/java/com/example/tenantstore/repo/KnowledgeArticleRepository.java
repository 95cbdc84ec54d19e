package com.example.tenantstore.repo;

import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.model.ArticleType;
import com.example.tenantstore.model.KnowledgeArticle;
import com.example.tenantstore.model.SecurityClassification;
import com.example.tenantstore.query.QueryFilter;
import com.example.tenantstore.query.QueryRequest;
import com.example.tenantstore.store.QueryPage;
import org.springframework.stereotype.Repository;

@Repository
public class KnowledgeArticleRepository extends HpkRepository<KnowledgeArticle> {

    public KnowledgeArticleRepository(RepositorySupport support) {
        super(EntityFamily.KNOWLEDGE_ARTICLE, KnowledgeArticle.class, support);
    }

    @Override
    protected String[] keyFieldsOf(KnowledgeArticle article) {
        return new String[] {article.getTenantId(), article.getArticleId()};
    }

    @Override
    protected void validate(KnowledgeArticle article) {
        require("KnowledgeArticle", "title", article.getTitle());
        require("KnowledgeArticle", "content", article.getContent());
        require("KnowledgeArticle", "contentType", article.getContentType());
        if (article.getSecurityLevel() == null) {
            article.setSecurityLevel(SecurityClassification.INTERNAL);
        }
    }

    /**
     * Articles of a tenant, filtered by any combination of tag, type and title text.
     */
    public QueryPage<KnowledgeArticle> findArticles(String tenantId, String tag, ArticleType contentType,
                                                    String titleContains, Integer pageSize, String continuationToken) {
        QueryRequest request = QueryRequest.forTenant(tenantId);
        if (tag != null) {
            request.getFilters().add(QueryFilter.arrayContains("tags", tag));
        }
        if (contentType != null) {
            request.getFilters().add(QueryFilter.eq("contentType", contentType.getValue()));
        }
        if (titleContains != null && !titleContains.isBlank()) {
            request.getFilters().add(QueryFilter.contains("title", titleContains));
        }
        request.setPageSize(pageSize);
        request.setContinuationToken(continuationToken);
        return query(request);
    }
}
