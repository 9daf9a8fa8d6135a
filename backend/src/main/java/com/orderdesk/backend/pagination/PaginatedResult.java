package com.orderdesk.backend.pagination;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaginatedResult<T> {
    private List<T> data;
    private PaginationMeta meta;

    public <R> PaginatedResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = data.stream()
                .map(mapper)
                .collect(Collectors.toList());
        return new PaginatedResult<>(mapped, meta);
    }
}
