package com.orderdesk.backend.model;

public enum OrderStatus {
    NEW,
    INPROGRESS,
    REJECTED,
    DONE
}
