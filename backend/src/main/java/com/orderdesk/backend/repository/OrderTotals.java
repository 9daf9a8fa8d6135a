package com.orderdesk.backend.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Count and price sum over a set of orders.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderTotals {
    private long totalOrders;
    private BigDecimal totalEarnings;
}
