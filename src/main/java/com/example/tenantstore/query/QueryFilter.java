package com.example.tenantstore.query;

import lombok.Value;

/**
 * Caller-supplied secondary filter. The value is always bound as a parameter.
 */
@Value
public class QueryFilter {
    String field;
    Operator operator;
    Object value;

    public static QueryFilter eq(String field, Object value) {
        return new QueryFilter(field, Operator.EQ, value);
    }

    public static QueryFilter gt(String field, Object value) {
        return new QueryFilter(field, Operator.GT, value);
    }

    public static QueryFilter gte(String field, Object value) {
        return new QueryFilter(field, Operator.GTE, value);
    }

    public static QueryFilter lt(String field, Object value) {
        return new QueryFilter(field, Operator.LT, value);
    }

    public static QueryFilter lte(String field, Object value) {
        return new QueryFilter(field, Operator.LTE, value);
    }

    public static QueryFilter contains(String field, String value) {
        return new QueryFilter(field, Operator.CONTAINS, value);
    }

    public static QueryFilter arrayContains(String field, Object value) {
        return new QueryFilter(field, Operator.ARRAY_CONTAINS, value);
    }
}
