package com.example.demo.reconciliation.model;

/**
 * The two datasets being reconciled.
 */
public enum Side {
    SYSTEM("system"),
    SUPPLIER("supplier");

    private final String label;

    Side(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
