package com.orderdesk.backend.cache;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups of cache keys that are dropped together after a write.
 */
public enum CacheRegion {
    USERS("users", "user"),
    ORDERS("orders", "order"),
    CUSTOMERS("customers", "customer"),
    STATISTICS("stats", null);

    private final String listPrefix;
    private final String detailPrefix;

    CacheRegion(String listPrefix, String detailPrefix) {
        this.listPrefix = listPrefix;
        this.detailPrefix = detailPrefix;
    }

    public String getListPrefix() {
        return listPrefix;
    }

    public String getDetailPrefix() {
        return detailPrefix;
    }

    public List<String> patterns() {
        List<String> patterns = new ArrayList<>();
        patterns.add(listPrefix + ":*");
        if (detailPrefix != null) {
            patterns.add(detailPrefix + ":*");
        }
        return patterns;
    }
}
