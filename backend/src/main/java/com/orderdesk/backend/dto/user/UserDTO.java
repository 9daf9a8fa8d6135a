package com.orderdesk.backend.dto.user;

import com.orderdesk.backend.model.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class UserDTO {
    private String id;
    private String firstName;
    private String lastName;
    private String email;
    private String country;
    private Boolean isEmailVerified;
    private Role role;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
