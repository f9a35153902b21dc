package com.example.demo.reconciliation.model;

import java.util.Collections;
import java.util.List;

/**
 * One side's documents merged into a single deduplicated item list, with the
 * counts and warnings collected along the way.
 */
public class AggregationResult {

    private final Side side;
    private final List<LineItem> items;
    private final int documentCount;
    private final int inputRowCount;
    private final List<String> documentNames;
    private final List<String> skippedDocumentNames;
    private final List<ReconciliationWarning> warnings;

    public AggregationResult(Side side, List<LineItem> items, int documentCount, int inputRowCount,
            List<String> documentNames, List<String> skippedDocumentNames,
            List<ReconciliationWarning> warnings) {
        this.side = side;
        this.items = Collections.unmodifiableList(items);
        this.documentCount = documentCount;
        this.inputRowCount = inputRowCount;
        this.documentNames = Collections.unmodifiableList(documentNames);
        this.skippedDocumentNames = Collections.unmodifiableList(skippedDocumentNames);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public Side getSide() {
        return side;
    }

    public List<LineItem> getItems() {
        return items;
    }

    /**
     * Documents supplied, including the ones skipped as empty.
     */
    public int getDocumentCount() {
        return documentCount;
    }

    public int getProcessedDocumentCount() {
        return documentNames.size();
    }

    /**
     * Rows supplied across all documents, before validation and merging.
     */
    public int getInputRowCount() {
        return inputRowCount;
    }

    public int getOutputItemCount() {
        return items.size();
    }

    /**
     * Names of the documents that contributed rows, in input order.
     */
    public List<String> getDocumentNames() {
        return documentNames;
    }

    public List<String> getSkippedDocumentNames() {
        return skippedDocumentNames;
    }

    public List<ReconciliationWarning> getWarnings() {
        return warnings;
    }
}
