package com.orderdesk.backend.pagination;

public final class PaginationDefaults {

    private PaginationDefaults() {}

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PER_PAGE = 20;

    /** Upper bound enforced on query parameters, not by the paginator. */
    public static final int MAX_PER_PAGE = 500;
}
