package com.example.tenantstore.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private String tenantId;

    /** Value of the family's second key field (project, user...), or null for tenant-wide queries. */
    private String scopeValue;

    @Builder.Default
    private List<QueryFilter> filters = new ArrayList<>();

    private SortOrder sort;

    private Integer pageSize;

    private String continuationToken;

    private boolean includeDeleted;

    public static QueryRequest forTenant(String tenantId) {
        return QueryRequest.builder().tenantId(tenantId).build();
    }
}
