package com.orderdesk.backend.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-customer order count and price sum. {@code id} is the customer id
 * (the {@code _id} of the group stage).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerTotals {
    private String id;
    private long orderCount;
    private BigDecimal totalSpending;
}
