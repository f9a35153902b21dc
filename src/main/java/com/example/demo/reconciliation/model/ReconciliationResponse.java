package com.example.demo.reconciliation.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Report handed to the reporting side. Statuses are rendered with the configured
 * display labels here and nowhere earlier.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationResponse {

    private final List<ResultLine> results;
    private final Summary summary;
    private final SideStatistics system;
    private final SideStatistics supplier;
    private final List<ReconciliationWarning> matchingWarnings;

    private ReconciliationResponse(List<ResultLine> results, Summary summary, SideStatistics system,
            SideStatistics supplier, List<ReconciliationWarning> matchingWarnings) {
        this.results = results;
        this.summary = summary;
        this.system = system;
        this.supplier = supplier;
        this.matchingWarnings = matchingWarnings;
    }

    public static ReconciliationResponse from(ReconciliationReport report) {
        ReconciliationSettings settings = report.getSettings();
        List<ResultLine> lines = report.getResults().stream()
                .map(result -> new ResultLine(settings.labelOf(result.getStatus()), result))
                .collect(Collectors.toList());

        ReconciliationSummary tally = report.getSummary();
        Map<String, Integer> counts = new LinkedHashMap<>();
        tally.getStatusCounts().forEach((status, count) -> counts.put(settings.labelOf(status), count));

        Summary summary = new Summary(tally.getTotalLines(), counts, tally.getMatchedByCode(),
                tally.getMatchedByName(), tally.getTotalProcessingTimeMs(), tally.isFullyMatched(),
                settings.getQuantityTolerance(), settings.getPriceTolerance());

        return new ReconciliationResponse(lines, summary,
                new SideStatistics(report.getSystemAggregation()),
                new SideStatistics(report.getSupplierAggregation()),
                report.getMatchingWarnings());
    }

    public List<ResultLine> getResults() {
        return results;
    }

    public Summary getSummary() {
        return summary;
    }

    public SideStatistics getSystem() {
        return system;
    }

    public SideStatistics getSupplier() {
        return supplier;
    }

    public List<ReconciliationWarning> getMatchingWarnings() {
        return matchingWarnings;
    }

    /**
     * One result row with its display label.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResultLine {
        private final String status;
        private final LineResult result;

        ResultLine(String status, LineResult result) {
            this.status = status;
            this.result = result;
        }

        public String getStatus() {
            return status;
        }

        public String getItemCode() {
            return result.getItemCode();
        }

        public String getItemName() {
            return result.getItemName();
        }

        public MatchMethod getMatchMethod() {
            return result.getMatchMethod();
        }

        public BigDecimal getSystemQuantity() {
            return result.getSystemQuantity();
        }

        public BigDecimal getSupplierQuantity() {
            return result.getSupplierQuantity();
        }

        public BigDecimal getSystemPrice() {
            return result.getSystemPrice();
        }

        public BigDecimal getSupplierPrice() {
            return result.getSupplierPrice();
        }

        public BigDecimal getSystemLineTotal() {
            return result.getSystemLineTotal();
        }

        public BigDecimal getSupplierLineTotal() {
            return result.getSupplierLineTotal();
        }

        public BigDecimal getSystemTaxRate() {
            return result.getSystemTaxRate();
        }

        public BigDecimal getSupplierTaxRate() {
            return result.getSupplierTaxRate();
        }

        public String getExplanation() {
            return result.getExplanation();
        }
    }

    public static class Summary {
        private final int totalLines;
        private final Map<String, Integer> statusCounts;
        private final int matchedByCode;
        private final int matchedByName;
        private final long totalProcessingTimeMs;
        private final boolean fullyMatched;
        private final BigDecimal quantityTolerance;
        private final BigDecimal priceTolerance;

        Summary(int totalLines, Map<String, Integer> statusCounts, int matchedByCode, int matchedByName,
                long totalProcessingTimeMs, boolean fullyMatched, BigDecimal quantityTolerance,
                BigDecimal priceTolerance) {
            this.totalLines = totalLines;
            this.statusCounts = statusCounts;
            this.matchedByCode = matchedByCode;
            this.matchedByName = matchedByName;
            this.totalProcessingTimeMs = totalProcessingTimeMs;
            this.fullyMatched = fullyMatched;
            this.quantityTolerance = quantityTolerance;
            this.priceTolerance = priceTolerance;
        }

        public int getTotalLines() {
            return totalLines;
        }

        public Map<String, Integer> getStatusCounts() {
            return statusCounts;
        }

        public int getMatchedByCode() {
            return matchedByCode;
        }

        public int getMatchedByName() {
            return matchedByName;
        }

        public long getTotalProcessingTimeMs() {
            return totalProcessingTimeMs;
        }

        public boolean isFullyMatched() {
            return fullyMatched;
        }

        public BigDecimal getQuantityTolerance() {
            return quantityTolerance;
        }

        public BigDecimal getPriceTolerance() {
            return priceTolerance;
        }
    }

    /**
     * Aggregation statistics of one side, passed through unmodified.
     */
    public static class SideStatistics {
        private final AggregationResult aggregation;

        SideStatistics(AggregationResult aggregation) {
            this.aggregation = aggregation;
        }

        public int getDocumentCount() {
            return aggregation.getDocumentCount();
        }

        public int getProcessedDocumentCount() {
            return aggregation.getProcessedDocumentCount();
        }

        public int getInputRowCount() {
            return aggregation.getInputRowCount();
        }

        public int getOutputItemCount() {
            return aggregation.getOutputItemCount();
        }

        public List<String> getDocumentNames() {
            return aggregation.getDocumentNames();
        }

        public List<String> getSkippedDocumentNames() {
            return aggregation.getSkippedDocumentNames();
        }

        public List<ReconciliationWarning> getWarnings() {
            return aggregation.getWarnings();
        }
    }
}
