package com.example.tenantstore.model;

import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * Curated knowledge-base article. Relevance score and tags come from external classifiers
 * and are stored as given.
 */
@Data
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class KnowledgeArticle extends BaseEntity {
    private String articleId;
    private String title;
    private String content;
    private ArticleType contentType;
    private List<String> tags;
    private Double relevanceScore;
    private List<Citation> citations;
    private SecurityClassification securityLevel;
    private List<String> keywords;
    private String sourceFile;
}
