package com.orderdesk.backend.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DashboardStatsDTO {
    private long userCustomers; // distinct customers reached by the caller's own orders
    private UserOrderStatsDTO orderStats;
    private List<CustomerSpendingDTO> customerSpending;
    private long totalCustomers;
    private BigDecimal totalSpending;
}
