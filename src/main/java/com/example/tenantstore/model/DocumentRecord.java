package com.example.tenantstore.model;

import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.List;

/**
 * Uploaded source document and its processing state.
 */
@Data
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DocumentRecord extends BaseEntity {
    private String projectId;
    private String documentId;
    private String fileName;
    private Long fileSize;
    private String contentType;
    private String uploadedBy;
    private List<String> tags;
    private DocumentStatus status;
    private String processingStage;
    private String errorMessage;
    private Instant processedAt;
    private List<String> chunkIds;
}
