package com.example.tenantstore.repo;

import com.example.tenantstore.exception.AlreadyExistsException;
import com.example.tenantstore.exception.EntityNotFoundException;
import com.example.tenantstore.exception.PartitionMismatchException;
import com.example.tenantstore.exception.ValidationException;
import com.example.tenantstore.exception.VersionConflictException;
import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.model.BaseEntity;
import com.example.tenantstore.query.QueryRequest;
import com.example.tenantstore.query.QuerySpec;
import com.example.tenantstore.registry.ContainerHandle;
import com.example.tenantstore.retry.OperationContext;
import com.example.tenantstore.store.QueryPage;
import com.example.tenantstore.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Create/read/update/query/delete for one entity family over hierarchical partition keys.
 * <p>
 * Keys are derived from the entity's own fields, so the same entity always maps to the same
 * document and retried creates are detected by the store as conflicts. Entities passed in are
 * copied before stamping; callers' instances are never modified.
 *
 * @param <T> entity type of the family
 */
public abstract class HpkRepository<T extends BaseEntity> {

    private static final Logger logger = LoggerFactory.getLogger(HpkRepository.class);

    protected final EntityFamily family;
    protected final RepositorySupport support;
    private final Class<T> type;
    private final int idIndex;

    protected HpkRepository(EntityFamily family, Class<T> type, RepositorySupport support) {
        this.family = family;
        this.type = type;
        this.support = support;
        this.idIndex = family.getKeyFields().indexOf(family.getIdField());
    }

    /** Key field values of the entity, in the family's key order. Values may be null. */
    protected abstract String[] keyFieldsOf(T entity);

    /**
     * Checks family-specific required fields and fills defaults. Runs before any store call on
     * create and update.
     */
    protected abstract void validate(T entity);

    public EntityFamily getFamily() {
        return family;
    }

    public T create(T entity) {
        return create(entity, OperationContext.none());
    }

    public T create(T entity, OperationContext context) {
        T copy = support.getMapper().copy(entity, type);
        validate(copy);
        String[] keys = keyFieldsOf(copy);
        String partitionKey = support.getCodec().build(family, keys);

        Instant now = support.getClock().instant();
        copy.setId(keys[idIndex]);
        copy.setPartitionKey(partitionKey);
        copy.setCreatedAt(now);
        copy.setUpdatedAt(now);
        copy.setVersion(1L);
        copy.setIsDeleted(false);
        copy.setDeletedAt(null);
        if (copy.getUpdatedBy() == null) {
            copy.setUpdatedBy(copy.getCreatedBy());
        }

        Map<String, Object> document = support.getMapper().toDocument(copy);
        try {
            Map<String, Object> stored = support.getRetryExecutor().execute(
                    "create " + partitionKey, () -> handle().create(document, partitionKey), context);
            logger.debug("Created {} {}", family, partitionKey);
            return support.getMapper().fromDocument(stored, type);
        } catch (StoreException e) {
            if (e.isConflict()) {
                throw new AlreadyExistsException(String.format("%s %s already exists", family, partitionKey), e);
            }
            throw e;
        }
    }

    /**
     * Point read. Absent and soft-deleted entities are reported as empty.
     */
    public Optional<T> get(String... keyFields) {
        return get(OperationContext.none(), keyFields);
    }

    public Optional<T> get(OperationContext context, String... keyFields) {
        return read(context, false, keyFields);
    }

    public Optional<T> getIncludingDeleted(String... keyFields) {
        return read(OperationContext.none(), true, keyFields);
    }

    public boolean exists(String... keyFields) {
        return get(keyFields).isPresent();
    }

    /**
     * Conditional replace. Stamps {@code updatedAt} and sets {@code version} to
     * {@code expectedVersion + 1}; fails with {@link VersionConflictException} if the stored
     * version differs. {@code createdAt}, {@code createdBy} and the soft-delete fields are
     * kept from the stored record whatever the entity carries.
     */
    public T update(T entity, long expectedVersion) {
        return update(entity, expectedVersion, OperationContext.none());
    }

    public T update(T entity, long expectedVersion, OperationContext context) {
        return replace(entity, expectedVersion, context, false);
    }

    /**
     * Hook for family rules that compare the stored entity with its replacement, such as
     * state machines. Runs after the stored record has been read and before the write.
     */
    protected void checkUpdate(T stored, T updated) {
    }

    private T replace(T entity, long expectedVersion, OperationContext context, boolean deleting) {
        T copy = support.getMapper().copy(entity, type);
        validate(copy);
        String[] keys = keyFieldsOf(copy);
        String partitionKey = support.getCodec().build(family, keys);
        String id = keys[idIndex];
        if (copy.getPartitionKey() != null && !copy.getPartitionKey().equals(partitionKey)) {
            throw new PartitionMismatchException(String.format(
                    "Partition key fields are immutable: stored %s, entity now maps to %s", copy.getPartitionKey(), partitionKey));
        }
        if (copy.getId() != null && !copy.getId().equals(id)) {
            throw new PartitionMismatchException(String.format("id is immutable: %s != %s", copy.getId(), id));
        }

        // server-owned fields always come from the stored record
        T stored = read(context, true, keys).orElseThrow(() -> new EntityNotFoundException(
                String.format("%s %s not found", family, partitionKey)));
        checkUpdate(stored, copy);
        copy.setCreatedAt(stored.getCreatedAt());
        copy.setCreatedBy(stored.getCreatedBy());
        if (!deleting) {
            copy.setIsDeleted(stored.isSoftDeleted());
            copy.setDeletedAt(stored.getDeletedAt());
        }

        Instant now = support.getClock().instant();
        Instant previous = stored.getUpdatedAt();
        if (previous != null && !now.isAfter(previous)) {
            now = previous.plusMillis(1);
        }
        copy.setId(id);
        copy.setPartitionKey(partitionKey);
        copy.setUpdatedAt(now);
        copy.setVersion(expectedVersion + 1);

        Map<String, Object> document = support.getMapper().toDocument(copy);
        try {
            Map<String, Object> written = support.getRetryExecutor().execute(
                    "update " + partitionKey, () -> handle().replace(document, partitionKey, expectedVersion), context);
            logger.debug("Updated {} {} to version {}", family, partitionKey, expectedVersion + 1);
            return support.getMapper().fromDocument(written, type);
        } catch (StoreException e) {
            if (e.isPreconditionFailed()) {
                throw new VersionConflictException(String.format(
                        "%s %s was modified concurrently (expected version %d)", family, partitionKey, expectedVersion),
                        expectedVersion, e);
            }
            if (e.isNotFound()) {
                throw new EntityNotFoundException(String.format("%s %s not found", family, partitionKey), e);
            }
            throw e;
        }
    }

    /**
     * Paged, tenant-scoped query. Soft-deleted entities are excluded unless the request asks for them.
     */
    public QueryPage<T> query(QueryRequest request) {
        return query(request, OperationContext.none());
    }

    public QueryPage<T> query(QueryRequest request, OperationContext context) {
        QuerySpec spec = support.getQueryBuilder().build(family, request);
        logger.debug("Query {}: {} {}", family, spec.toSql(), spec.getParameters().keySet());
        QueryPage<Map<String, Object>> page = support.getRetryExecutor().execute(
                "query " + family.getContainer(), () -> handle().query(spec), context);
        return page.map(document -> support.getMapper().fromDocument(document, type));
    }

    /**
     * Number of entities matching the request's partition-scoped predicates. Paging fields are ignored.
     */
    public long count(QueryRequest request) {
        return count(request, OperationContext.none());
    }

    public long count(QueryRequest request, OperationContext context) {
        QuerySpec spec = support.getQueryBuilder().build(family, request);
        return support.getRetryExecutor().execute(
                "count " + family.getContainer(), () -> handle().count(spec), context);
    }

    /**
     * Flags the entity as deleted through a versioned update. The record stays in the store.
     */
    public T softDelete(String... keyFields) {
        return softDelete(OperationContext.none(), keyFields);
    }

    public T softDelete(OperationContext context, String... keyFields) {
        T current = requireExisting(context, true, keyFields);
        if (current.isSoftDeleted()) {
            return current;
        }
        current.setIsDeleted(true);
        current.setDeletedAt(support.getClock().instant());
        return replace(current, current.getVersion(), context, true);
    }

    /** Physically removes the entity. Administrative use only. */
    public void hardDelete(String... keyFields) {
        hardDelete(OperationContext.none(), keyFields);
    }

    public void hardDelete(OperationContext context, String... keyFields) {
        String partitionKey = support.getCodec().build(family, keyFields);
        String id = keyFields[idIndex];
        try {
            support.getRetryExecutor().execute("delete " + partitionKey, () -> {
                handle().delete(id, partitionKey);
                return null;
            }, context);
            logger.info("Hard-deleted {} {}", family, partitionKey);
        } catch (StoreException e) {
            if (e.isNotFound()) {
                throw new EntityNotFoundException(String.format("%s %s not found", family, partitionKey), e);
            }
            throw e;
        }
    }

    protected T requireExisting(OperationContext context, boolean includeDeleted, String... keyFields) {
        return read(context, includeDeleted, keyFields).orElseThrow(() -> new EntityNotFoundException(
                String.format("%s %s not found", family, Arrays.toString(keyFields))));
    }

    protected ContainerHandle handle() {
        return support.getRegistry().getHandle(family);
    }

    protected static void require(String entityType, String field, Object value) {
        if (value == null || (value instanceof String && ((String) value).isBlank())) {
            throw ValidationException.required(entityType, field);
        }
    }

    private Optional<T> read(OperationContext context, boolean includeDeleted, String... keyFields) {
        String partitionKey = support.getCodec().build(family, keyFields);
        String id = keyFields[idIndex];
        Optional<Map<String, Object>> found;
        try {
            found = support.getRetryExecutor().execute(
                    "read " + partitionKey, () -> handle().read(id, partitionKey), context);
        } catch (StoreException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
        return found.map(document -> support.getMapper().fromDocument(document, type))
                .filter(entity -> includeDeleted || !entity.isSoftDeleted());
    }
}
