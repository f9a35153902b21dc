package com.example.demo.reconciliation.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tally of a reconciliation run. Every status is present in the tally, with zero
 * when no line ended up in it.
 */
public class ReconciliationSummary {

    private final int totalLines;
    private final Map<LineStatus, Integer> statusCounts;
    private final int matchedByCode;
    private final int matchedByName;
    private final long totalProcessingTimeMs;

    public ReconciliationSummary(int totalLines, Map<LineStatus, Integer> statusCounts,
            int matchedByCode, int matchedByName, long totalProcessingTimeMs) {
        EnumMap<LineStatus, Integer> counts = new EnumMap<>(LineStatus.class);
        for (LineStatus status : LineStatus.values()) {
            counts.put(status, statusCounts.getOrDefault(status, 0));
        }
        this.totalLines = totalLines;
        this.statusCounts = Collections.unmodifiableMap(counts);
        this.matchedByCode = matchedByCode;
        this.matchedByName = matchedByName;
        this.totalProcessingTimeMs = totalProcessingTimeMs;
    }

    public int getTotalLines() {
        return totalLines;
    }

    public Map<LineStatus, Integer> getStatusCounts() {
        return statusCounts;
    }

    public int getCount(LineStatus status) {
        return statusCounts.get(status);
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

    /**
     * True when every line is OK, i.e. the invoice can be approved as is.
     */
    public boolean isFullyMatched() {
        return totalLines > 0 && getCount(LineStatus.OK) == totalLines;
    }
}
