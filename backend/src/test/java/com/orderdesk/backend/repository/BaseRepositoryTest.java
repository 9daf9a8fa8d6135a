package com.orderdesk.backend.repository;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.orderdesk.backend.model.Order;
import com.orderdesk.backend.pagination.PaginateOptions;
import com.orderdesk.backend.pagination.PaginatedResult;
import com.orderdesk.backend.pagination.Paginator;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BaseRepositoryTest {

    private MongoTemplate mongoTemplate;
    private OrderRepository repository;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        repository = new OrderRepository(mongoTemplate, new Paginator(Runnable::run));
    }

    @Test
    void findUniqueByIdForwardsToFindById() {
        Order order = Order.builder().id("o1").build();
        when(mongoTemplate.findById("o1", Order.class)).thenReturn(order);

        assertThat(repository.findUnique("o1")).contains(order);
        assertThat(repository.findUnique("missing")).isEmpty();
    }

    @Test
    void orThrowVerbsRaiseEmptyResult() {
        Query query = new Query(Criteria.where("title").is("nope"));

        assertThatThrownBy(() -> repository.findUniqueOrThrow(query))
                .isInstanceOf(EmptyResultDataAccessException.class);
        assertThatThrownBy(() -> repository.findFirstOrThrow(query))
                .isInstanceOf(EmptyResultDataAccessException.class);
    }

    @Test
    void findFirstLimitsToOneRow() {
        Query query = new Query(Criteria.where("userId").is("u1"));

        repository.findFirst(query);

        verify(mongoTemplate).findOne(argThat(q -> q.getLimit() == 1), eq(Order.class));
        assertThat(query.getLimit()).isZero();
    }

    @Test
    void updateReturnsTheNewDocument() {
        Query query = new Query(Criteria.where("id").is("o1"));
        Update update = new Update().set("title", "Renamed order");
        Order updated = Order.builder().id("o1").title("Renamed order").build();
        when(mongoTemplate.findAndModify(eq(query), eq(update), any(FindAndModifyOptions.class), eq(Order.class)))
                .thenReturn(updated);

        Optional<Order> result = repository.update(query, update);

        assertThat(result).contains(updated);
    }

    @Test
    void bulkVerbsReportAffectedCounts() {
        Query query = new Query(Criteria.where("customerId").is("c1"));
        Update update = new Update().unset("customerId");
        when(mongoTemplate.updateMulti(query, update, Order.class)).thenReturn(UpdateResult.acknowledged(3, 2L, null));
        when(mongoTemplate.remove(query, Order.class)).thenReturn(DeleteResult.acknowledged(4));

        assertThat(repository.updateMany(query, update)).isEqualTo(2);
        assertThat(repository.deleteMany(query)).isEqualTo(4);
    }

    @Test
    void groupByRunsMatchThenGroup() {
        AggregationResults<OrderTotals> results =
                new AggregationResults<>(List.of(new OrderTotals(2, null)), new Document());
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(Order.class), eq(OrderTotals.class))).thenReturn(results);

        List<OrderTotals> totals = repository.groupBy(
                Criteria.where("userId").is("u1"), Aggregation.group().count().as("totalOrders"), OrderTotals.class);

        assertThat(totals).extracting(OrderTotals::getTotalOrders).containsExactly(2L);
    }

    @Test
    void findManyPaginatedUsesTheRepositoryAsSource() {
        when(mongoTemplate.count(any(Query.class), eq(Order.class))).thenReturn(1L);
        when(mongoTemplate.find(any(Query.class), eq(Order.class))).thenReturn(List.of(Order.builder().id("o1").build()));

        PaginatedResult<Order> page = repository.findManyPaginated(new Query(), PaginateOptions.of(1, 10));

        assertThat(page.getData()).extracting(Order::getId).containsExactly("o1");
        assertThat(page.getMeta().getTotal()).isEqualTo(1);
    }

    @Test
    void driverErrorsPropagateUnchanged() {
        when(mongoTemplate.count(any(Query.class), eq(Order.class)))
                .thenThrow(new DataAccessResourceFailureException("socket closed"));

        assertThatThrownBy(() -> repository.count(new Query()))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }
}
