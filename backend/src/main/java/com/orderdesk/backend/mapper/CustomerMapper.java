package com.orderdesk.backend.mapper;

import com.orderdesk.backend.dto.customer.CustomerDTO;
import com.orderdesk.backend.model.Customer;
import com.orderdesk.backend.model.Order;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class CustomerMapper {

    @Autowired
    private OrderMapper orderMapper;

    public CustomerDTO toDto(Customer customer, List<Order> orders) {
        if (customer == null) {
            return null;
        }

        return CustomerDTO.builder()
                .id(customer.getId())
                .fullName(customer.getFullName())
                .email(customer.getEmail())
                .telegram(customer.getTelegram())
                .company(customer.getCompany())
                .createdAt(customer.getCreatedAt())
                .updatedAt(customer.getUpdatedAt())
                .orders(orders.stream().map(orderMapper::toDto).collect(Collectors.toList()))
                .build();
    }
}
