package com.orderdesk.backend.dto.order;

import com.orderdesk.backend.model.Category;
import com.orderdesk.backend.model.OrderStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update. Ownership and the customer link are not editable here;
 * the link moves through the customer attach/detach endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpdateOrderRequest {

    @Size(min = 5, max = 200, message = "Title must be between 5 and 200 characters.")
    private String title;

    @Size(min = 10, max = 1500, message = "Description must be between 10 and 1500 characters.")
    private String description;

    @DecimalMin(value = "0", message = "Price must not be negative.")
    private BigDecimal price;

    private LocalDate startDate;
    private LocalDate endDate;
    private Category category;
    private OrderStatus status;
}
