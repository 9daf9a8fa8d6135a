package com.orderdesk.backend.dto.order;

import com.orderdesk.backend.model.Category;
import com.orderdesk.backend.model.OrderStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateOrderRequest {

    @NotBlank(message = "Title is required.")
    @Size(min = 5, max = 200, message = "Title must be between 5 and 200 characters.")
    private String title;

    @NotBlank(message = "Description is required.")
    @Size(min = 10, max = 1500, message = "Description must be between 10 and 1500 characters.")
    private String description;

    @NotNull(message = "Price is required.")
    @DecimalMin(value = "0", message = "Price must not be negative.")
    private BigDecimal price;

    @NotNull(message = "Start date is required.")
    private LocalDate startDate;

    @NotNull(message = "End date is required.")
    private LocalDate endDate;

    @NotNull(message = "Category is required.")
    private Category category;

    private OrderStatus status;

    private String customerId;
}
