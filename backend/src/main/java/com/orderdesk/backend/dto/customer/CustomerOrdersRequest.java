package com.orderdesk.backend.dto.customer;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerOrdersRequest {

    @NotEmpty(message = "At least one order id is required.")
    private List<String> orderIds;
}
