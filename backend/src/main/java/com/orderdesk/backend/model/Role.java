package com.orderdesk.backend.model;

public enum Role {
    ADMIN,
    MANAGER,
    FREELANCER
}
