package com.example.tenantstore.query;

import lombok.Value;

@Value
public class SortOrder {

    public enum Direction { ASC, DESC }

    String field;
    Direction direction;

    public static SortOrder asc(String field) {
        return new SortOrder(field, Direction.ASC);
    }

    public static SortOrder desc(String field) {
        return new SortOrder(field, Direction.DESC);
    }
}
