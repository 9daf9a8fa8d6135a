package com.orderdesk.backend.pagination;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginatorTest {

    private final Paginator paginator = new Paginator(Runnable::run);

    /**
     * Serves rows 1..total, honoring skip and limit the way MongoDB does.
     */
    private static class RowSource implements PaginationSource<Integer> {
        private final List<Integer> rows;
        private final AtomicInteger countCalls = new AtomicInteger();
        private final AtomicInteger findCalls = new AtomicInteger();

        RowSource(int total) {
            this.rows = IntStream.rangeClosed(1, total).boxed().collect(Collectors.toList());
        }

        @Override
        public List<Integer> findMany(Query query) {
            findCalls.incrementAndGet();
            return rows.stream()
                    .skip(query.getSkip())
                    .limit(query.getLimit() > 0 ? query.getLimit() : Long.MAX_VALUE)
                    .collect(Collectors.toList());
        }

        @Override
        public long count(Query query) {
            countCalls.incrementAndGet();
            return rows.size();
        }
    }

    @Test
    void middlePageOfFortyFiveRows() {
        PaginatedResult<Integer> result = paginator.paginate(new RowSource(45), new Query(), PaginateOptions.of(2, 20));

        assertThat(result.getData()).hasSize(20).startsWith(21).endsWith(40);
        PaginationMeta meta = result.getMeta();
        assertThat(meta.getTotal()).isEqualTo(45);
        assertThat(meta.getLastPage()).isEqualTo(3);
        assertThat(meta.getCurrentPage()).isEqualTo(2);
        assertThat(meta.getPerPage()).isEqualTo(20);
        assertThat(meta.getPrev()).isEqualTo(1);
        assertThat(meta.getNext()).isEqualTo(3);
    }

    @Test
    void lastPageIsPartialAndHasNoNext() {
        PaginatedResult<Integer> result = paginator.paginate(new RowSource(45), new Query(), PaginateOptions.of(3, 20));

        assertThat(result.getData()).containsExactly(41, 42, 43, 44, 45);
        assertThat(result.getMeta().getNext()).isNull();
        assertThat(result.getMeta().getPrev()).isEqualTo(2);
    }

    @Test
    void missingOptionsFallBackToDefaults() {
        PaginatedResult<Integer> result = paginator.paginate(new RowSource(45), new Query(), new PaginateOptions());

        assertThat(result.getMeta().getCurrentPage()).isEqualTo(PaginationDefaults.DEFAULT_PAGE);
        assertThat(result.getMeta().getPerPage()).isEqualTo(PaginationDefaults.DEFAULT_PER_PAGE);
        assertThat(result.getMeta().getPrev()).isNull();
        assertThat(result.getData()).hasSize(20).startsWith(1);
    }

    @Test
    void nonPositivePageIsTreatedAsFirstPage() {
        PaginatedResult<Integer> result = paginator.paginate(new RowSource(45), new Query(), PaginateOptions.of(-4, 10));

        assertThat(result.getMeta().getCurrentPage()).isEqualTo(1);
        assertThat(result.getData()).startsWith(1);
    }

    @Test
    void emptySourceYieldsZeroPages() {
        PaginatedResult<Integer> result = paginator.paginate(new RowSource(0), new Query(), PaginateOptions.of(1, 20));

        assertThat(result.getData()).isEmpty();
        assertThat(result.getMeta().getTotal()).isZero();
        assertThat(result.getMeta().getLastPage()).isZero();
        assertThat(result.getMeta().getNext()).isNull();
        assertThat(result.getMeta().getPrev()).isNull();
    }

    @Test
    void pageBeyondTheEndIsEmptyButKeepsTotals() {
        PaginatedResult<Integer> result = paginator.paginate(new RowSource(45), new Query(), PaginateOptions.of(7, 20));

        assertThat(result.getData()).isEmpty();
        assertThat(result.getMeta().getTotal()).isEqualTo(45);
        assertThat(result.getMeta().getLastPage()).isEqualTo(3);
        assertThat(result.getMeta().getNext()).isNull();
        assertThat(result.getMeta().getPrev()).isEqualTo(6);
    }

    @Test
    void lastPageAndNeighboursHoldForEveryPage() {
        RowSource source = new RowSource(101);
        for (int perPage : new int[]{1, 7, 20, 100, 500}) {
            int expectedLastPage = (int) Math.ceil(101 / (double) perPage);
            for (int page = 1; page <= expectedLastPage + 1; page++) {
                PaginationMeta meta = paginator.paginate(source, new Query(), PaginateOptions.of(page, perPage)).getMeta();

                assertThat(meta.getLastPage()).isEqualTo(expectedLastPage);
                assertThat(meta.getNext() == null).isEqualTo(page >= expectedLastPage);
                assertThat(meta.getPrev() == null).isEqualTo(page <= 1);
            }
        }
    }

    @Test
    void distinctCountUsesTheUnpagedResult() {
        RowSource source = new RowSource(12);

        PaginatedResult<Integer> result = paginator.paginate(source, new Query(), true, PaginateOptions.of(1, 5));

        assertThat(result.getMeta().getTotal()).isEqualTo(12);
        assertThat(source.countCalls.get()).isZero();
        assertThat(source.findCalls.get()).isEqualTo(2);
    }

    @Test
    void doesNotMutateTheCallersQuery() {
        Query query = new Query();

        paginator.paginate(new RowSource(45), query, PaginateOptions.of(3, 20));

        assertThat(query.getSkip()).isZero();
        assertThat(query.getLimit()).isZero();
    }

    @Test
    void zeroPerPageIsRejected() {
        assertThatThrownBy(() -> paginator.paginate(new RowSource(5), new Query(), PaginateOptions.of(1, 0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void sourceFailurePropagatesUnwrapped() {
        PaginationSource<Integer> broken = new PaginationSource<>() {
            @Override
            public List<Integer> findMany(Query query) {
                return List.of();
            }

            @Override
            public long count(Query query) {
                throw new DataAccessResourceFailureException("connection reset");
            }
        };

        assertThatThrownBy(() -> paginator.paginate(broken, new Query(), PaginateOptions.of(1, 10)))
                .isInstanceOf(DataAccessResourceFailureException.class)
                .hasMessage("connection reset");
    }
}
