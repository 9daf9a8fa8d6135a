package com.orderdesk.backend.pagination;

import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

/**
 * The query capability the {@link Paginator} pages over.
 */
public interface PaginationSource<T> {

    List<T> findMany(Query query);

    long count(Query query);
}
