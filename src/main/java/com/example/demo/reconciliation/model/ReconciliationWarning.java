package com.example.demo.reconciliation.model;

/**
 * Non-fatal, informational note about an anomaly found while merging documents
 * or matching items.
 */
public final class ReconciliationWarning {

    private final WarningType type;
    private final String message;

    public ReconciliationWarning(WarningType type, String message) {
        this.type = type;
        this.message = message;
    }

    public WarningType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
