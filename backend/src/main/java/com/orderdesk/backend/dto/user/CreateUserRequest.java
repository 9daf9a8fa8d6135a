package com.orderdesk.backend.dto.user;

import com.orderdesk.backend.model.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateUserRequest {

    @NotBlank(message = "First name is required.")
    @Size(max = 100)
    private String firstName;

    @NotBlank(message = "Last name is required.")
    @Size(max = 100)
    private String lastName;

    @NotBlank(message = "Email is required.")
    @Email(message = "Please provide a valid email address.")
    private String email;

    @NotBlank(message = "Password is required.")
    @Size(min = 8, max = 100, message = "Password must be between 8 and 100 characters.")
    private String password;

    private String country;

    private Role role; // defaults to FREELANCER

    private Boolean isEmailVerified;
}
