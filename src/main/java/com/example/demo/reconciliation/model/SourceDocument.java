package com.example.demo.reconciliation.model;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.constraints.NotBlank;

/**
 * The rows of one source document (a delivery note, an invoice), already in the
 * canonical shape but not yet deduplicated.
 */
public class SourceDocument {

    @NotBlank(message = "Document name is required")
    private String name;

    /**
     * Not validated here: the aggregator skips invalid rows one by one instead of
     * rejecting the whole request.
     */
    private List<LineItem> rows = new ArrayList<>();

    public SourceDocument() {
    }

    public SourceDocument(String name, List<LineItem> rows) {
        this.name = name;
        this.rows = rows;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<LineItem> getRows() {
        return rows;
    }

    public void setRows(List<LineItem> rows) {
        this.rows = rows;
    }
}
