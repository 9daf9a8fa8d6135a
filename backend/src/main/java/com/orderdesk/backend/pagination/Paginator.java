package com.orderdesk.backend.pagination;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Offset paginator. The page fetch and the total count are issued
 * concurrently and both must finish before the page is assembled.
 */
@Slf4j
@Component
public class Paginator {

    private final Executor queryExecutor;

    public Paginator(@Qualifier("queryExecutor") Executor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    public <T> PaginatedResult<T> paginate(PaginationSource<T> source, Query query, PaginateOptions options) {
        return paginate(source, query, false, options);
    }

    /**
     * @param distinct when set, the total is the size of the unpaged result
     *                 instead of a count issued to the database
     */
    public <T> PaginatedResult<T> paginate(PaginationSource<T> source,
                                           Query query,
                                           boolean distinct,
                                           PaginateOptions options) {
        PaginateOptions effective = options != null ? options : new PaginateOptions();
        int page = effective.resolvePage();
        int perPage = effective.resolvePerPage();

        if (perPage <= 0) {
            throw new IllegalStateException("perPage must be positive, got " + perPage);
        }

        long skip = page > 0 ? (long) perPage * (page - 1) : 0;
        Query pageQuery = Query.of(query).skip(skip).limit(perPage);

        CompletableFuture<Long> totalFuture = distinct
                ? CompletableFuture.supplyAsync(() -> (long) source.findMany(Query.of(query)).size(), queryExecutor)
                : CompletableFuture.supplyAsync(() -> source.count(Query.of(query)), queryExecutor);
        CompletableFuture<List<T>> dataFuture =
                CompletableFuture.supplyAsync(() -> source.findMany(pageQuery), queryExecutor);

        long total;
        List<T> data;
        try {
            CompletableFuture.allOf(totalFuture, dataFuture).join();
            total = totalFuture.join();
            data = dataFuture.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        int lastPage = (int) ((total + perPage - 1) / perPage);

        PaginationMeta meta = PaginationMeta.builder()
                .total(total)
                .lastPage(lastPage)
                .currentPage(page)
                .perPage(perPage)
                .prev(page > 1 ? page - 1 : null)
                .next(page < lastPage ? page + 1 : null)
                .build();

        log.debug("Paginated page {} of {} ({} rows, {} total)", page, lastPage, data.size(), total);
        return new PaginatedResult<>(data, meta);
    }
}
