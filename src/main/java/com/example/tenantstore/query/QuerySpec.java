package com.example.tenantstore.query;

import com.example.tenantstore.key.EntityFamily;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A parameterized, partition-scoped query ready for a {@code DocumentStore}.
 */
@Value
@Builder
public class QuerySpec {

    EntityFamily family;

    @Singular
    List<Predicate> predicates;

    Map<String, Object> parameters;

    SortOrder sort;

    int pageSize;

    String continuationToken;

    public String getContainer() {
        return family.getContainer();
    }

    /**
     * Renders the query in the SQL dialect of the document database. Values appear only
     * as {@code @name} placeholders.
     */
    public String toSql() {
        String where = predicates.stream().map(QuerySpec::render).collect(Collectors.joining(" AND "));
        return "SELECT * FROM c WHERE " + where
                + " ORDER BY c." + sort.getField() + " " + sort.getDirection();
    }

    private static String render(Predicate p) {
        String field = "c." + p.getField();
        String param = "@" + p.getParameterName();
        switch (p.getOperator()) {
            case CONTAINS:
                return "CONTAINS(LOWER(" + field + "), LOWER(" + param + "))";
            case ARRAY_CONTAINS:
                return "ARRAY_CONTAINS(" + field + ", " + param + ")";
            case NOT_TRUE:
                return "(NOT IS_DEFINED(" + field + ") OR " + field + " != true)";
            default:
                return field + " " + p.getOperator().getSymbol() + " " + param;
        }
    }
}
