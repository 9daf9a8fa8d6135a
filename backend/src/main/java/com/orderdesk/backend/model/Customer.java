package com.orderdesk.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * A customer groups orders. The link lives on the order side
 * ({@link Order#getCustomerId()}), so the orders of a customer are
 * always queried, never stored here.
 */
@Document(collection = "customers")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Customer {

    @Id
    private String id;

    private String fullName;
    private String email;
    private String telegram;
    private String company;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
