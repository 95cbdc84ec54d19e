package com.example.tenantstore.query;

import com.example.tenantstore.exception.ValidationException;
import com.example.tenantstore.key.EntityFamily;
import com.example.tenantstore.key.PartitionKeyCodec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds partition-scoped queries. The tenant equality predicate is always first,
 * followed by the optional second-level scope; caller filters come after.
 */
public class QueryBuilder {

    public static final String DELETED_FIELD = "isDeleted";
    public static final SortOrder DEFAULT_SORT = SortOrder.desc("createdAt");

    private static final Pattern FIELD_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_.]*$");

    private final PartitionKeyCodec codec;
    private final int defaultPageSize;
    private final int maxPageSize;

    public QueryBuilder(PartitionKeyCodec codec, int defaultPageSize, int maxPageSize) {
        if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("page sizes must satisfy 1 <= default <= max");
        }
        this.codec = codec;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public QuerySpec build(EntityFamily family, QueryRequest request) {
        String tenantField = family.getKeyFields().get(0);
        codec.validateIdentity(tenantField, request.getTenantId());

        QuerySpec.QuerySpecBuilder spec = QuerySpec.builder().family(family);
        Map<String, Object> parameters = new LinkedHashMap<>();

        spec.predicate(new Predicate(tenantField, Operator.EQ, tenantField));
        parameters.put(tenantField, request.getTenantId());

        if (request.getScopeValue() != null) {
            String scopeField = family.getScopeFields().get(1);
            codec.validateIdentity(scopeField, request.getScopeValue());
            spec.predicate(new Predicate(scopeField, Operator.EQ, scopeField));
            parameters.put(scopeField, request.getScopeValue());
        }

        int index = 0;
        if (request.getFilters() != null) {
            for (QueryFilter filter : request.getFilters()) {
                validateFilter(family, filter);
                String name = "p" + index++;
                spec.predicate(new Predicate(filter.getField(), filter.getOperator(), name));
                parameters.put(name, normalize(filter.getValue()));
            }
        }

        if (!request.isIncludeDeleted()) {
            spec.predicate(new Predicate(DELETED_FIELD, Operator.NOT_TRUE, null));
        }

        SortOrder sort = request.getSort() == null ? DEFAULT_SORT : request.getSort();
        requireFieldName(sort.getField());

        return spec.parameters(Collections.unmodifiableMap(parameters))
                .sort(sort)
                .pageSize(effectivePageSize(request.getPageSize()))
                .continuationToken(request.getContinuationToken())
                .build();
    }

    int effectivePageSize(Integer requested) {
        if (requested == null || requested < 1) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }

    private void validateFilter(EntityFamily family, QueryFilter filter) {
        requireFieldName(filter.getField());
        if (filter.getOperator() == null || filter.getOperator() == Operator.NOT_TRUE) {
            throw new ValidationException("Unsupported operator on " + filter.getField() + ": " + filter.getOperator());
        }
        if (filter.getValue() == null) {
            throw new ValidationException("Filter on " + filter.getField() + " has no value");
        }
        if (family.isKeyField(filter.getField()) && filter.getOperator() != Operator.EQ) {
            throw new ValidationException(String.format(
                    "Partition field %s only supports exact equality, got %s", filter.getField(), filter.getOperator()));
        }
        if (family.isKeyField(filter.getField())) {
            codec.validateIdentity(filter.getField(), String.valueOf(filter.getValue()));
        }
    }

    private static void requireFieldName(String field) {
        if (field == null || !FIELD_NAME.matcher(field).matches()) {
            throw new ValidationException("Invalid field name: " + field);
        }
    }

    // timestamps are stored as epoch millis
    private static Object normalize(Object value) {
        if (value instanceof Instant) {
            return ((Instant) value).toEpochMilli();
        }
        return value;
    }
}
