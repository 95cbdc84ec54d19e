package com.example.tenantstore.config;

import com.example.tenantstore.key.PartitionKeyCodec;
import com.example.tenantstore.query.QueryBuilder;
import com.example.tenantstore.registry.ContainerRegistry;
import com.example.tenantstore.repo.RepositorySupport;
import com.example.tenantstore.retry.RetryExecutor;
import com.example.tenantstore.retry.RetryPolicy;
import com.example.tenantstore.retry.Sleeper;
import com.example.tenantstore.retry.StoreErrorClassifier;
import com.example.tenantstore.store.DocumentStore;
import com.example.tenantstore.store.EntityMapper;
import com.example.tenantstore.store.MongoDocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Process-wide wiring: one store connection, one registry, shared by every repository.
 */
@Configuration
public class TenantStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PartitionKeyCodec partitionKeyCodec() {
        return new PartitionKeyCodec();
    }

    @Bean
    public EntityMapper entityMapper(ObjectMapper objectMapper) {
        return new EntityMapper(objectMapper);
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${app.retry.max-attempts:3}") int maxAttempts,
                                   @Value("${app.retry.base-delay-ms:1000}") long baseDelayMs,
                                   @Value("${app.retry.max-delay-ms:30000}") long maxDelayMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs));
    }

    @Bean
    public RetryExecutor retryExecutor(RetryPolicy retryPolicy, Clock clock) {
        return new RetryExecutor(retryPolicy, new StoreErrorClassifier(), Sleeper.THREAD, clock);
    }

    @Bean
    public QueryBuilder queryBuilder(PartitionKeyCodec codec,
                                     @Value("${app.query.default-page-size:20}") int defaultPageSize,
                                     @Value("${app.query.max-page-size:100}") int maxPageSize) {
        return new QueryBuilder(codec, defaultPageSize, maxPageSize);
    }

    @Bean
    public DocumentStore documentStore(MongoTemplate mongoTemplate) {
        return new MongoDocumentStore(mongoTemplate);
    }

    @Bean
    public ContainerRegistry containerRegistry(DocumentStore documentStore, Clock clock) {
        return new ContainerRegistry(documentStore, clock);
    }

    @Bean
    public RepositorySupport repositorySupport(ContainerRegistry registry, PartitionKeyCodec codec,
                                               RetryExecutor retryExecutor, QueryBuilder queryBuilder,
                                               EntityMapper entityMapper, Clock clock) {
        return new RepositorySupport(registry, codec, retryExecutor, queryBuilder, entityMapper, clock);
    }
}
