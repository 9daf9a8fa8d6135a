package com.orderdesk.backend.mapper;

import com.orderdesk.backend.dto.order.OrderDTO;
import com.orderdesk.backend.model.Order;
import org.springframework.stereotype.Component;

@Component
public class OrderMapper {
    public OrderDTO toDto(Order order) {
        if (order == null) {
            return null;
        }

        return OrderDTO.builder()
                .id(order.getId())
                .title(order.getTitle())
                .description(order.getDescription())
                .price(order.getPrice())
                .startDate(order.getStartDate())
                .endDate(order.getEndDate())
                .category(order.getCategory())
                .status(order.getStatus())
                .userId(order.getUserId())
                .customerId(order.getCustomerId())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
