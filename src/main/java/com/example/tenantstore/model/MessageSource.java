package com.example.tenantstore.model;

import lombok.*;

/** Citation attached to an assistant message. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageSource {
    private String documentId;
    private String chunkId;
    private String title;
    private String excerpt;
    private Double confidence;
    private Integer page;
}
