package com.example.demo.reconciliation.model;

public enum WarningType {
    EMPTY_DOCUMENTS,
    INVALID_ROWS,
    ZERO_QUANTITY_ROWS,
    PRICE_CONFLICT,
    AMBIGUOUS_NAME_MATCH
}
