package com.example.tenantstore.model;

import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.Set;

@Data
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Project extends BaseEntity {

    public static final String METADATA = "metadata";
    public static final Set<String> ENTITY_TYPES = Set.of(METADATA, "settings", "users", "documents");

    private String projectId;
    /** Third key level; project records themselves use {@value #METADATA}. */
    private String entityType;
    private String name;
    private String description;
    private String owner;
    private ProjectStatus status;
    private SecurityClassification classification;
    private RagConfiguration ragConfiguration;
}
