package com.example.tenantstore.repo;

import com.example.tenantstore.key.PartitionKeyCodec;
import com.example.tenantstore.query.QueryBuilder;
import com.example.tenantstore.registry.ContainerRegistry;
import com.example.tenantstore.retry.RetryExecutor;
import com.example.tenantstore.store.EntityMapper;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * Collaborators shared by every repository, wired once per process.
 */
@Getter
@RequiredArgsConstructor
public class RepositorySupport {
    private final ContainerRegistry registry;
    private final PartitionKeyCodec codec;
    private final RetryExecutor retryExecutor;
    private final QueryBuilder queryBuilder;
    private final EntityMapper mapper;
    private final Clock clock;
}
