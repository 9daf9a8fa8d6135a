package com.orderdesk.backend.dto.user;

import com.orderdesk.backend.model.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update; null fields are left untouched.
 */
@Data
public class UpdateUserRequest {

    @Size(min = 1, max = 100)
    private String firstName;

    @Size(min = 1, max = 100)
    private String lastName;

    @Email(message = "Please provide a valid email address.")
    private String email;

    private String country;

    private Role role;
}
