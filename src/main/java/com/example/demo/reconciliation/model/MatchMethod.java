package com.example.demo.reconciliation.model;

public enum MatchMethod {
    BY_CODE,
    BY_NAME,
    NONE
}
