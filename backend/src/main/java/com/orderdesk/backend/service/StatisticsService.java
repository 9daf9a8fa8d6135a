package com.orderdesk.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.orderdesk.backend.cache.CacheKeys;
import com.orderdesk.backend.cache.QueryCache;
import com.orderdesk.backend.dto.stats.CustomerSpendingDTO;
import com.orderdesk.backend.dto.stats.DashboardStatsDTO;
import com.orderdesk.backend.dto.stats.TopCustomerByOrdersDTO;
import com.orderdesk.backend.dto.stats.TopCustomerBySpendingDTO;
import com.orderdesk.backend.dto.stats.TopExpensiveOrderDTO;
import com.orderdesk.backend.dto.stats.UserCustomerStatsDTO;
import com.orderdesk.backend.dto.stats.UserOrderStatsDTO;
import com.orderdesk.backend.model.Customer;
import com.orderdesk.backend.model.Role;
import com.orderdesk.backend.repository.CustomerTotals;
import com.orderdesk.backend.repository.OrderTotals;
import com.orderdesk.backend.repository.StatisticsRepository;
import com.orderdesk.backend.security.AccessPolicy;
import com.orderdesk.backend.security.AuthUser;
import com.orderdesk.backend.utils.Persistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Aggregate figures over orders and customers. Results are cached under
 * {@code stats:*} keys, which every order or customer write drops.
 */
@Slf4j
@Service
public class StatisticsService {

    static final int DEFAULT_LIMIT = 5;
    static final int MAX_LIMIT = 100;

    private static final Role[] ALL_ROLES = {Role.ADMIN, Role.MANAGER, Role.FREELANCER};

    @Autowired
    private StatisticsRepository statisticsRepository;

    @Autowired
    private QueryCache queryCache;

    @Autowired
    private AccessPolicy accessPolicy;

    public UserCustomerStatsDTO getUserCustomerStats(AuthUser actor, String userId) {
        accessPolicy.requireRole(actor, Role.ADMIN, Role.FREELANCER);
        accessPolicy.requireSelfOrAdmin(actor, userId);

        return cached(CacheKeys.userCustomerStats(userId), new TypeReference<UserCustomerStatsDTO>() {
        }, "Failed to get user customer stats", () -> new UserCustomerStatsDTO(
                userId, statisticsRepository.countDistinctCustomers(userId)));
    }

    public UserOrderStatsDTO getUserOrderStats(AuthUser actor, String userId) {
        accessPolicy.requireRole(actor, Role.ADMIN, Role.FREELANCER);
        accessPolicy.requireSelfOrAdmin(actor, userId);

        return cached(CacheKeys.userOrderStats(userId), new TypeReference<UserOrderStatsDTO>() {
        }, "Failed to get user order stats", () -> toOrderStats(statisticsRepository.orderTotals(userId)));
    }

    public List<TopExpensiveOrderDTO> getTopExpensiveOrders(AuthUser actor, Integer limit) {
        accessPolicy.requireRole(actor, ALL_ROLES);
        int effectiveLimit = clampLimit(limit);
        boolean isAdmin = accessPolicy.isAdmin(actor);

        return cached(CacheKeys.topExpensiveOrders(actor.getId(), effectiveLimit), new TypeReference<List<TopExpensiveOrderDTO>>() {
        }, "Failed to get top expensive orders", () -> statisticsRepository
                .topExpensiveOrders(actor.getId(), isAdmin, effectiveLimit).stream()
                .map(order -> new TopExpensiveOrderDTO(order.getId(), order.getTitle(), order.getPrice()))
                .collect(Collectors.toList()));
    }

    public List<CustomerSpendingDTO> getCustomerSpending(AuthUser actor) {
        accessPolicy.requireRole(actor, ALL_ROLES);
        boolean isAdmin = accessPolicy.isAdmin(actor);

        return cached(CacheKeys.customerSpending(actor.getId()), new TypeReference<List<CustomerSpendingDTO>>() {
        }, "Failed to get customer spending", () -> customerSpending(actor.getId(), isAdmin));
    }

    public List<TopCustomerBySpendingDTO> getTopCustomersBySpending(AuthUser actor, Integer limit) {
        accessPolicy.requireRole(actor, ALL_ROLES);
        int effectiveLimit = clampLimit(limit);
        boolean isAdmin = accessPolicy.isAdmin(actor);

        return cached(CacheKeys.topSpendingCustomers(actor.getId(), effectiveLimit), new TypeReference<List<TopCustomerBySpendingDTO>>() {
        }, "Failed to get top customers by spending", () -> {
            List<CustomerTotals> ranking =
                    statisticsRepository.topCustomersBySpending(actor.getId(), isAdmin, effectiveLimit);
            Map<String, Customer> customers = customersById(ranking);
            return ranking.stream()
                    .filter(totals -> customers.containsKey(totals.getId()))
                    .map(totals -> {
                        Customer customer = customers.get(totals.getId());
                        return new TopCustomerBySpendingDTO(customer.getId(), customer.getFullName(),
                                customer.getEmail(), orZero(totals.getTotalSpending()));
                    })
                    .collect(Collectors.toList());
        });
    }

    public List<TopCustomerByOrdersDTO> getTopCustomersByOrders(AuthUser actor, Integer limit) {
        accessPolicy.requireRole(actor, ALL_ROLES);
        int effectiveLimit = clampLimit(limit);
        boolean isAdmin = accessPolicy.isAdmin(actor);

        return cached(CacheKeys.topCustomersByOrders(actor.getId(), effectiveLimit), new TypeReference<List<TopCustomerByOrdersDTO>>() {
        }, "Failed to get top customers by orders", () -> {
            List<CustomerTotals> ranking =
                    statisticsRepository.topCustomersByOrders(actor.getId(), isAdmin, effectiveLimit);
            Map<String, Customer> customers = customersById(ranking);
            return ranking.stream()
                    .filter(totals -> customers.containsKey(totals.getId()))
                    .map(totals -> new TopCustomerByOrdersDTO(totals.getId(),
                            customers.get(totals.getId()).getFullName(), totals.getOrderCount()))
                    .collect(Collectors.toList());
        });
    }

    public DashboardStatsDTO getDashboardStats(AuthUser actor) {
        accessPolicy.requireRole(actor, ALL_ROLES);
        boolean isAdmin = accessPolicy.isAdmin(actor);

        return cached(CacheKeys.dashboard(actor.getId()), new TypeReference<DashboardStatsDTO>() {
        }, "Failed to get dashboard stats", () -> {
            List<CustomerSpendingDTO> spending = customerSpending(actor.getId(), isAdmin);
            return DashboardStatsDTO.builder()
                    .userCustomers(statisticsRepository.countDistinctCustomers(actor.getId()))
                    .orderStats(toOrderStats(statisticsRepository.orderTotals(actor.getId())))
                    .customerSpending(spending)
                    .totalCustomers(spending.size())
                    .totalSpending(spending.stream()
                            .map(CustomerSpendingDTO::getTotalSpending)
                            .reduce(BigDecimal.ZERO, BigDecimal::add))
                    .build();
        });
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    // Admins also see customers without any order; others only customers their orders reach
    private List<CustomerSpendingDTO> customerSpending(String userId, boolean isAdmin) {
        Map<String, CustomerTotals> totals = statisticsRepository.customerTotals(userId, isAdmin).stream()
                .collect(Collectors.toMap(CustomerTotals::getId, Function.identity()));
        List<Customer> customers = isAdmin
                ? statisticsRepository.findAllCustomers()
                : statisticsRepository.findCustomers(totals.keySet());

        return customers.stream()
                .map(customer -> new CustomerSpendingDTO(customer.getId(), customer.getFullName(),
                        totals.containsKey(customer.getId())
                                ? orZero(totals.get(customer.getId()).getTotalSpending())
                                : BigDecimal.ZERO))
                .collect(Collectors.toList());
    }

    private Map<String, Customer> customersById(List<CustomerTotals> ranking) {
        List<String> ids = ranking.stream().map(CustomerTotals::getId).collect(Collectors.toList());
        return statisticsRepository.findCustomers(ids).stream()
                .collect(Collectors.toMap(Customer::getId, Function.identity()));
    }

    private static UserOrderStatsDTO toOrderStats(OrderTotals totals) {
        return new UserOrderStatsDTO(totals.getTotalOrders(), orZero(totals.getTotalEarnings()));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return Objects.requireNonNullElse(value, BigDecimal.ZERO);
    }

    private <T> T cached(String key, TypeReference<T> type, String failureMessage, Supplier<T> loader) {
        return queryCache.getOrLoad(key, type, queryCache.getStatsTtl(), () -> {
            log.info("Computing statistics for {}", key);
            return Persistence.call(failureMessage, loader);
        });
    }
}
