package com.example.tenantstore.query;

import lombok.Value;

/**
 * One condition of a built query. The value lives in {@link QuerySpec#getParameters()}
 * under {@code parameterName}; {@code NOT_TRUE} predicates carry no parameter.
 */
@Value
public class Predicate {
    String field;
    Operator operator;
    String parameterName;
}
