package com.orderdesk.backend.mapper;

import com.orderdesk.backend.dto.user.UserDTO;
import com.orderdesk.backend.model.User;
import org.springframework.stereotype.Component;


@Component
public class UserMapper {
    public UserDTO toDto(User user) {
        if (user == null) {
            return null;
        }

        return UserDTO.builder()
                .id(user.getId())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .email(user.getEmail())
                .country(user.getCountry())
                .isEmailVerified(user.getIsEmailVerified())
                .role(user.getRole())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
