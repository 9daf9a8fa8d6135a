package com.orderdesk.backend.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TopCustomerByOrdersDTO {
    private String id;
    private String fullName;
    private long orderCount;
}
