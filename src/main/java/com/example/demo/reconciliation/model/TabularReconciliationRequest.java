package com.example.demo.reconciliation.model;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public class TabularReconciliationRequest {

    @NotEmpty(message = "At least one system document is required")
    private List<@NotNull(message = "Document must not be null") @Valid TabularDocument> systemDocuments =
            new ArrayList<>();

    @NotEmpty(message = "At least one supplier document is required")
    private List<@NotNull(message = "Document must not be null") @Valid TabularDocument> supplierDocuments =
            new ArrayList<>();

    public TabularReconciliationRequest() {
    }

    public TabularReconciliationRequest(List<TabularDocument> systemDocuments,
            List<TabularDocument> supplierDocuments) {
        this.systemDocuments = systemDocuments;
        this.supplierDocuments = supplierDocuments;
    }

    public List<TabularDocument> getSystemDocuments() {
        return systemDocuments;
    }

    public void setSystemDocuments(List<TabularDocument> systemDocuments) {
        this.systemDocuments = systemDocuments;
    }

    public List<TabularDocument> getSupplierDocuments() {
        return supplierDocuments;
    }

    public void setSupplierDocuments(List<TabularDocument> supplierDocuments) {
        this.supplierDocuments = supplierDocuments;
    }
}
