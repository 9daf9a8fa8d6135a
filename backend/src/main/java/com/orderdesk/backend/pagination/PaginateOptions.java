package com.orderdesk.backend.pagination;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaginateOptions {
    private Integer page;
    private Integer perPage;

    public static PaginateOptions of(Integer page, Integer perPage) {
        return new PaginateOptions(page, perPage);
    }

    // Absent or non-positive pages fall back to the first page.
    public int resolvePage() {
        return page == null || page <= 0 ? PaginationDefaults.DEFAULT_PAGE : page;
    }

    public int resolvePerPage() {
        return perPage == null ? PaginationDefaults.DEFAULT_PER_PAGE : perPage;
    }
}
