package com.orderdesk.backend.dto.customer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateCustomerRequest {

    @NotBlank(message = "Full name is required.")
    @Size(min = 2, max = 150)
    private String fullName;

    @Email(message = "Please provide a valid email address.")
    private String email;

    @Size(max = 100)
    private String telegram;

    @Size(max = 150)
    private String company;

    // Orders to link right away; all must be free and accessible or nothing is created
    private List<String> orderIds;
}
