package com.example.demo.reconciliation.model;

import java.util.Collections;
import java.util.List;

/**
 * Everything one reconciliation run hands to the reporting side: the result rows,
 * the tally, both aggregation outcomes unmodified, and the matching warnings.
 */
public class ReconciliationReport {

    private final List<LineResult> results;
    private final ReconciliationSummary summary;
    private final AggregationResult systemAggregation;
    private final AggregationResult supplierAggregation;
    private final List<ReconciliationWarning> matchingWarnings;
    private final ReconciliationSettings settings;

    public ReconciliationReport(List<LineResult> results, ReconciliationSummary summary,
            AggregationResult systemAggregation, AggregationResult supplierAggregation,
            List<ReconciliationWarning> matchingWarnings, ReconciliationSettings settings) {
        this.results = Collections.unmodifiableList(results);
        this.summary = summary;
        this.systemAggregation = systemAggregation;
        this.supplierAggregation = supplierAggregation;
        this.matchingWarnings = matchingWarnings;
        this.settings = settings;
    }

    public List<LineResult> getResults() {
        return results;
    }

    public ReconciliationSummary getSummary() {
        return summary;
    }

    public AggregationResult getSystemAggregation() {
        return systemAggregation;
    }

    public AggregationResult getSupplierAggregation() {
        return supplierAggregation;
    }

    public List<ReconciliationWarning> getMatchingWarnings() {
        return matchingWarnings;
    }

    /**
     * Settings the run used, so the report can state its tolerances and labels.
     */
    public ReconciliationSettings getSettings() {
        return settings;
    }
}
