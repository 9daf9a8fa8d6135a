package com.orderdesk.backend.dto;

import com.orderdesk.backend.pagination.PaginateOptions;
import com.orderdesk.backend.pagination.PaginationDefaults;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.data.domain.Sort;

/**
 * Paging and sorting query parameters shared by every list endpoint.
 */
@Data
public class PageQuery {

    private Integer page;

    @Min(value = 1, message = "perPage must be at least 1.")
    @Max(value = PaginationDefaults.MAX_PER_PAGE, message = "perPage must not exceed 500.")
    private Integer perPage;

    private String sortBy;

    @Pattern(regexp = "(?i)asc|desc", message = "order must be 'asc' or 'desc'.")
    private String order;

    public PaginateOptions toPaginateOptions() {
        return PaginateOptions.of(page, perPage);
    }

    public Sort.Direction direction() {
        return "desc".equalsIgnoreCase(order) ? Sort.Direction.DESC : Sort.Direction.ASC;
    }
}
