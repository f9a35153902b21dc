package com.example.demo.reconciliation.model;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Documents of both sides, already in the canonical row shape.
 */
public class ReconciliationRequest {

    @NotEmpty(message = "At least one system document is required")
    private List<@NotNull(message = "Document must not be null") @Valid SourceDocument> systemDocuments =
            new ArrayList<>();

    @NotEmpty(message = "At least one supplier document is required")
    private List<@NotNull(message = "Document must not be null") @Valid SourceDocument> supplierDocuments =
            new ArrayList<>();

    public ReconciliationRequest() {
    }

    public ReconciliationRequest(List<SourceDocument> systemDocuments, List<SourceDocument> supplierDocuments) {
        this.systemDocuments = systemDocuments;
        this.supplierDocuments = supplierDocuments;
    }

    public List<SourceDocument> getSystemDocuments() {
        return systemDocuments;
    }

    public void setSystemDocuments(List<SourceDocument> systemDocuments) {
        this.systemDocuments = systemDocuments;
    }

    public List<SourceDocument> getSupplierDocuments() {
        return supplierDocuments;
    }

    public void setSupplierDocuments(List<SourceDocument> supplierDocuments) {
        this.supplierDocuments = supplierDocuments;
    }
}
