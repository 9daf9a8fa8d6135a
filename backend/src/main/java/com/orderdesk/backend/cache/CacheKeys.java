package com.orderdesk.backend.cache;

import org.springframework.data.domain.Sort;

public final class CacheKeys {

    private CacheKeys() {
    }

    public static String listKey(CacheRegion region, int page, int perPage,
                                 String sortBy, Sort.Direction direction, String filtersJson) {
        return region.getListPrefix()
                + ":page=" + page
                + ":size=" + perPage
                + ":sortBy=" + (sortBy != null ? sortBy : "none")
                + ":order=" + (direction != null ? direction.name().toLowerCase() : "asc")
                + ":filters=" + filtersJson;
    }

    public static String detailKey(CacheRegion region, String id) {
        return region.getDetailPrefix() + ":" + id;
    }

    // --- Statistics ---

    public static String userCustomerStats(String userId) {
        return "stats:user:" + userId + ":customers";
    }

    public static String userOrderStats(String userId) {
        return "stats:user:" + userId + ":orders";
    }

    public static String topExpensiveOrders(String callerId, int limit) {
        return "stats:orders:top-expensive:" + callerId + ":" + limit;
    }

    public static String customerSpending(String callerId) {
        return "stats:customers:spending:" + callerId;
    }

    public static String topSpendingCustomers(String callerId, int limit) {
        return "stats:customers:top-spending:" + callerId + ":" + limit;
    }

    public static String topCustomersByOrders(String callerId, int limit) {
        return "stats:customers:top-orders:" + callerId + ":" + limit;
    }

    public static String dashboard(String callerId) {
        return "stats:dashboard:" + callerId;
    }
}
