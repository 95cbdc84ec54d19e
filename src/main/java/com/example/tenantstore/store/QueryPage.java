package com.example.tenantstore.store;

import lombok.Value;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One bounded page of query results. {@code continuationToken} is null on the last page.
 */
@Value
public class QueryPage<T> {

    List<T> items;
    String continuationToken;
    double requestCharge;

    public boolean hasMore() {
        return continuationToken != null;
    }

    public <R> QueryPage<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().map(mapper).collect(Collectors.toList());
        return new QueryPage<>(mapped, continuationToken, requestCharge);
    }
}
