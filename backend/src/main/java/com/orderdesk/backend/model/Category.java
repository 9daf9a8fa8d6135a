package com.orderdesk.backend.model;

public enum Category {
    FRONTEND,
    BACKEND,
    FULLSTACK,
    DATABASE,
    SMM,
    ADS,
    TRANSLATION,
    DESIGN
}
