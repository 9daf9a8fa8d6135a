package com.orderdesk.backend.dto.customer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpdateCustomerRequest {

    @Size(min = 2, max = 150)
    private String fullName;

    @Email(message = "Please provide a valid email address.")
    private String email;

    @Size(max = 100)
    private String telegram;

    @Size(max = 150)
    private String company;
}
