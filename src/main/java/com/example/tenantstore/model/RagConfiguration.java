package com.example.tenantstore.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RagConfiguration {
    @Builder.Default
    private String chunkingStrategy = "semantic";
    @Builder.Default
    private Integer chunkSize = 1000;
    @Builder.Default
    private Integer chunkOverlap = 200;
    @Builder.Default
    private Integer retrievalTopK = 5;

    // Guardrails
    @Builder.Default
    private Boolean contentFiltering = true;
    @Builder.Default
    private Boolean citationsRequired = true;
    @Builder.Default
    private Boolean piiRedaction = false;

    public static RagConfiguration defaults() {
        return RagConfiguration.builder().build();
    }
}
