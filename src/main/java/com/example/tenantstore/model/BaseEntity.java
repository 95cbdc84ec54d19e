package com.example.tenantstore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Fields every stored entity carries. {@code id}, {@code partitionKey}, timestamps and
 * {@code version} are stamped by the repository.
 */
@Data
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
public abstract class BaseEntity {
    private String id;
    private String tenantId;
    private String partitionKey;
    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;
    private String updatedBy;
    private Long version;

    // Soft delete
    private Boolean isDeleted;
    private Instant deletedAt;

    @JsonIgnore
    public boolean isSoftDeleted() {
        return Boolean.TRUE.equals(isDeleted);
    }
}
