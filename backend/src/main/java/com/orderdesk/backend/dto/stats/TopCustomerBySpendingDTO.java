package com.orderdesk.backend.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TopCustomerBySpendingDTO {
    private String id;
    private String fullName;
    private String email;
    private BigDecimal totalSpending;
}
