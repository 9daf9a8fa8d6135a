package com.orderdesk.backend.pagination;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaginationMeta {
    private long total;
    private int lastPage;
    private int currentPage;
    private int perPage;
    private Integer prev;
    private Integer next;
}
