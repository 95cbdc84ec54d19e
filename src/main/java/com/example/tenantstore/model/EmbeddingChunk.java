package com.example.tenantstore.model;

import lombok.*;
import lombok.experimental.SuperBuilder;

@Data
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EmbeddingChunk extends BaseEntity {
    private String projectId;
    private String chunkId;
    private String documentId;
    private Integer chunkIndex;
    private float[] vector;
    private String model;
    private String text;
    private Integer pageNumber;
    private Integer offset;
    private Integer length;
}
