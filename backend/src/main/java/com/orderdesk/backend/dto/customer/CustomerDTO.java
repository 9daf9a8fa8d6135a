package com.orderdesk.backend.dto.customer;

import com.orderdesk.backend.dto.order.OrderDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomerDTO {
    private String id;
    private String fullName;
    private String email;
    private String telegram;
    private String company;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<OrderDTO> orders;
}
