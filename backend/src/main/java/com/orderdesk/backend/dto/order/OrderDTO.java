package com.orderdesk.backend.dto.order;

import com.orderdesk.backend.model.Category;
import com.orderdesk.backend.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderDTO {
    private String id;
    private String title;
    private String description;
    private BigDecimal price;
    private LocalDate startDate;
    private LocalDate endDate;
    private Category category;
    private OrderStatus status;
    private String userId;
    private String customerId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
