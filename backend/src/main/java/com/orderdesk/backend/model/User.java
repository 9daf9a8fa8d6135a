package com.orderdesk.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Document(collection = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    private String id;

    private String firstName;
    private String lastName;

    @Indexed(unique = true)
    private String email;

    private String password; // BCrypt hash, never leaves the service layer
    private String country;
    private Boolean isEmailVerified;

    @Builder.Default
    private Role role = Role.FREELANCER;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
