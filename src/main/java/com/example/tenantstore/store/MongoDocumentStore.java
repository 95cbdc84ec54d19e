package com.example.tenantstore.store;

import com.example.tenantstore.query.Predicate;
import com.example.tenantstore.query.QuerySpec;
import com.example.tenantstore.query.SortOrder;
import com.mongodb.MongoException;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link DocumentStore} backed by MongoDB (or the Cosmos DB API for MongoDB).
 * The stored {@code _id} is {@code partitionKey#id}, so ids only need to be unique per partition.
 */
public class MongoDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);

    private static final String MONGO_ID = "_id";
    // Cosmos DB API for MongoDB reports throttling as code 16500 with "RetryAfterMs=n" in the message
    private static final int COSMOS_THROTTLED = 16500;
    private static final Pattern RETRY_AFTER_MS = Pattern.compile("RetryAfterMs=(\\d+)");

    private final MongoTemplate mongo;

    public MongoDocumentStore(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public Map<String, Object> create(String container, Map<String, Object> document, String partitionKey) {
        String id = requireId(document);
        Document d = new Document(document);
        d.put(MONGO_ID, storageId(partitionKey, id));
        translate(() -> mongo.insert(d, container));
        logger.debug("Created {} in {} (partition {})", id, container, partitionKey);
        return toMap(d);
    }

    @Override
    public Optional<Map<String, Object>> read(String container, String id, String partitionKey) {
        Document found = translate(() -> mongo.findById(storageId(partitionKey, id), Document.class, container));
        return Optional.ofNullable(found).map(MongoDocumentStore::toMap);
    }

    @Override
    public Map<String, Object> replace(String container, Map<String, Object> document, String partitionKey, long expectedVersion) {
        String id = requireId(document);
        String storageId = storageId(partitionKey, id);
        Document d = new Document(document);
        d.put(MONGO_ID, storageId);

        Query current = new Query(Criteria.where(MONGO_ID).is(storageId).and(VERSION).is(expectedVersion));
        Document replaced = translate(() ->
                mongo.findAndReplace(current, d, FindAndReplaceOptions.options().returnNew(), container));
        if (replaced != null) {
            return toMap(replaced);
        }
        boolean exists = translate(() -> mongo.exists(new Query(Criteria.where(MONGO_ID).is(storageId)), container));
        if (exists) {
            throw new StoreException(StoreException.PRECONDITION_FAILED,
                    String.format("%s in %s is no longer at version %d", id, container, expectedVersion));
        }
        throw new StoreException(StoreException.NOT_FOUND, String.format("%s not found in %s", id, container));
    }

    @Override
    public void delete(String container, String id, String partitionKey) {
        Query byId = new Query(Criteria.where(MONGO_ID).is(storageId(partitionKey, id)));
        DeleteResult result = translate(() -> mongo.remove(byId, container));
        if (result.getDeletedCount() == 0) {
            throw new StoreException(StoreException.NOT_FOUND, String.format("%s not found in %s", id, container));
        }
    }

    @Override
    public QueryPage<Map<String, Object>> query(String container, QuerySpec spec) {
        Query q = filter(spec);

        SortOrder sort = spec.getSort();
        Sort.Direction direction = sort.getDirection() == SortOrder.Direction.ASC ? Sort.Direction.ASC : Sort.Direction.DESC;
        q.with(Sort.by(new Sort.Order(direction, sort.getField()), Sort.Order.asc(MONGO_ID)));

        int offset = decodeToken(spec.getContinuationToken());
        q.skip(offset).limit(spec.getPageSize() + 1);

        List<Document> docs = translate(() -> mongo.find(q, Document.class, container));
        String next = null;
        if (docs.size() > spec.getPageSize()) {
            docs = docs.subList(0, spec.getPageSize());
            next = encodeToken(offset + spec.getPageSize());
        }
        List<Map<String, Object>> items = docs.stream().map(MongoDocumentStore::toMap).collect(Collectors.toList());
        logger.debug("Query on {} returned {} items (offset {})", container, items.size(), offset);
        return new QueryPage<>(items, next, 0);
    }

    @Override
    public long count(String container, QuerySpec spec) {
        Query q = filter(spec);
        return translate(() -> mongo.count(q, container));
    }

    @Override
    public void resolveContainer(String container, List<String> indexedFields) {
        translate(() -> {
            if (!mongo.collectionExists(container)) {
                mongo.createCollection(container);
                logger.info("Created collection {}", container);
            }
            Index index = new Index();
            indexedFields.forEach(field -> index.on(field, Sort.Direction.ASC));
            mongo.indexOps(container).ensureIndex(index);
            return null;
        });
    }

    @Override
    public void ping(String container) {
        translate(() -> mongo.findOne(new Query().limit(1), Document.class, container));
    }

    static String storageId(String partitionKey, String id) {
        return partitionKey + "#" + id;
    }

    private static Query filter(QuerySpec spec) {
        List<Criteria> criteria = spec.getPredicates().stream()
                .map(p -> toCriteria(p, spec.getParameters()))
                .collect(Collectors.toList());
        return new Query(new Criteria().andOperator(criteria));
    }

    private static Criteria toCriteria(Predicate p, Map<String, Object> parameters) {
        Object value = p.getParameterName() == null ? null : parameters.get(p.getParameterName());
        Criteria where = Criteria.where(p.getField());
        switch (p.getOperator()) {
            case EQ:
            case ARRAY_CONTAINS:
                return where.is(value);
            case GT:
                return where.gt(value);
            case GTE:
                return where.gte(value);
            case LT:
                return where.lt(value);
            case LTE:
                return where.lte(value);
            case CONTAINS:
                return where.regex(Pattern.quote(String.valueOf(value)), "i");
            case NOT_TRUE:
                return where.ne(true);
            default:
                throw new StoreException(StoreException.BAD_REQUEST, "Unsupported operator " + p.getOperator());
        }
    }

    private static String requireId(Map<String, Object> document) {
        Object id = document.get(ID);
        if (!(id instanceof String) || ((String) id).isEmpty()) {
            throw new StoreException(StoreException.BAD_REQUEST, "Document has no id");
        }
        return (String) id;
    }

    private static Map<String, Object> toMap(Document d) {
        Map<String, Object> out = new LinkedHashMap<>(d);
        out.remove(MONGO_ID);
        return out;
    }

    static String encodeToken(int offset) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(String.valueOf(offset).getBytes(StandardCharsets.UTF_8));
    }

    static int decodeToken(String token) {
        if (token == null || token.isEmpty()) {
            return 0;
        }
        try {
            int offset = Integer.parseInt(new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8));
            if (offset < 0) {
                throw new NumberFormatException("negative offset");
            }
            return offset;
        } catch (IllegalArgumentException e) {
            throw new StoreException(StoreException.BAD_REQUEST, "Invalid continuation token", e);
        }
    }

    private <T> T translate(Supplier<T> call) {
        try {
            return call.get();
        } catch (DuplicateKeyException e) {
            throw new StoreException(StoreException.CONFLICT, "Document already exists", e);
        } catch (QueryTimeoutException e) {
            throw new StoreException(StoreException.TIMEOUT, e.getMessage(), e);
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new StoreException(StoreException.SERVICE_UNAVAILABLE, e.getMessage(), e);
        } catch (InvalidDataAccessApiUsageException e) {
            throw new StoreException(StoreException.BAD_REQUEST, e.getMessage(), e);
        } catch (DataAccessException | MongoException e) {
            throw translateUncategorized(e);
        }
    }

    private static StoreException translateUncategorized(RuntimeException e) {
        MongoException mongoError = e instanceof MongoException ? (MongoException) e : findMongoCause(e);
        if (mongoError != null && mongoError.getCode() == COSMOS_THROTTLED) {
            Matcher m = RETRY_AFTER_MS.matcher(String.valueOf(mongoError.getMessage()));
            Duration retryAfter = m.find() ? Duration.ofMillis(Long.parseLong(m.group(1))) : null;
            return StoreException.throttled("Request rate is large", retryAfter, e);
        }
        return new StoreException(StoreException.INTERNAL_ERROR, e.getMessage(), e);
    }

    private static MongoException findMongoCause(Throwable e) {
        for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
            if (t instanceof MongoException) {
                return (MongoException) t;
            }
        }
        return null;
    }
}
