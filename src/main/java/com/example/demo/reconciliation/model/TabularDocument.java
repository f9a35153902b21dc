package com.example.demo.reconciliation.model;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A document as the parsing side delivers it: a header row with the supplier's
 * own column names, and string cells.
 */
public class TabularDocument {

    @NotBlank(message = "Document name is required")
    private String name;

    @NotNull(message = "Headers are required")
    private List<String> headers = new ArrayList<>();

    private List<List<String>> rows = new ArrayList<>();

    public TabularDocument() {
    }

    public TabularDocument(String name, List<String> headers, List<List<String>> rows) {
        this.name = name;
        this.headers = headers;
        this.rows = rows;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public void setHeaders(List<String> headers) {
        this.headers = headers;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public void setRows(List<List<String>> rows) {
        this.rows = rows;
    }
}
