package com.orderdesk.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Document(collection = "orders")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Order {

    @Id
    private String id;

    private String title;
    private String description;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal price;

    private LocalDate startDate;
    private LocalDate endDate;
    private Category category;

    @Builder.Default
    private OrderStatus status = OrderStatus.NEW;

    @Indexed
    private String userId; // owner

    @Indexed
    private String customerId; // null until linked to a customer

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
