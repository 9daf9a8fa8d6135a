package com.orderdesk.backend.repository;

import com.orderdesk.backend.model.Customer;
import com.orderdesk.backend.model.Order;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate queries behind the statistics endpoints. Non-admin callers only
 * ever see figures computed from their own orders.
 */
@Repository
public class StatisticsRepository {

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private CustomerRepository customerRepository;

    private static Criteria ordersOf(String userId, boolean isAdmin) {
        return isAdmin ? new Criteria() : Criteria.where("userId").is(userId);
    }

    private static Criteria linkedOrdersOf(String userId, boolean isAdmin) {
        Criteria linked = Criteria.where("customerId").ne(null);
        return isAdmin ? linked : Criteria.where("userId").is(userId).and("customerId").ne(null);
    }

    public long countDistinctCustomers(String userId) {
        return customerTotals(userId, false).size();
    }

    public OrderTotals orderTotals(String userId) {
        List<OrderTotals> result = orderRepository.groupBy(
                Criteria.where("userId").is(userId),
                Aggregation.group().count().as("totalOrders").sum("price").as("totalEarnings"),
                OrderTotals.class);
        if (result.isEmpty()) {
            return new OrderTotals(0, BigDecimal.ZERO);
        }
        OrderTotals totals = result.get(0);
        if (totals.getTotalEarnings() == null) {
            totals.setTotalEarnings(BigDecimal.ZERO);
        }
        return totals;
    }

    public List<Order> topExpensiveOrders(String userId, boolean isAdmin, int limit) {
        Query query = new Query(ordersOf(userId, isAdmin))
                .with(Sort.by(Sort.Direction.DESC, "price"))
                .limit(limit);
        return orderRepository.findMany(query);
    }

    /**
     * One row per customer reached by the orders in scope. Customers without
     * any order in scope are absent.
     */
    public List<CustomerTotals> customerTotals(String userId, boolean isAdmin) {
        return orderRepository.groupBy(
                linkedOrdersOf(userId, isAdmin),
                Aggregation.group("customerId").count().as("orderCount").sum("price").as("totalSpending"),
                CustomerTotals.class);
    }

    public List<CustomerTotals> topCustomersBySpending(String userId, boolean isAdmin, int limit) {
        return customerTotals(userId, isAdmin).stream()
                .sorted(Comparator.comparing(CustomerTotals::getTotalSpending,
                        Comparator.nullsFirst(Comparator.<BigDecimal>naturalOrder())).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<CustomerTotals> topCustomersByOrders(String userId, boolean isAdmin, int limit) {
        return customerTotals(userId, isAdmin).stream()
                .sorted(Comparator.comparingLong(CustomerTotals::getOrderCount).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<Customer> findCustomers(Collection<String> ids) {
        return customerRepository.findMany(new Query(Criteria.where("id").in(ids)));
    }

    public List<Customer> findAllCustomers() {
        return customerRepository.findMany(new Query());
    }
}
