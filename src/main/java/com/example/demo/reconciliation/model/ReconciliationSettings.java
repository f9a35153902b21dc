package com.example.demo.reconciliation.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one reconciliation run.
 */
public final class ReconciliationSettings {

    public static final BigDecimal DEFAULT_QUANTITY_TOLERANCE = BigDecimal.ZERO;
    public static final BigDecimal DEFAULT_PRICE_TOLERANCE = new BigDecimal("0.01");

    private static final Map<LineStatus, String> DEFAULT_LABELS;

    static {
        EnumMap<LineStatus, String> labels = new EnumMap<>(LineStatus.class);
        labels.put(LineStatus.OK, "OK");
        labels.put(LineStatus.DEVIATION, "DEVIATION");
        labels.put(LineStatus.MISSING_FROM_SUPPLIER, "MISSING ON INVOICE");
        labels.put(LineStatus.MISSING_FROM_SYSTEM, "MISSING IN SYSTEM");
        labels.put(LineStatus.PARTIAL, "PARTIAL");
        labels.put(LineStatus.DUPLICATE_CODE, "DUPLICATE CODE ERROR");
        DEFAULT_LABELS = Collections.unmodifiableMap(labels);
    }

    private final BigDecimal quantityTolerance;
    private final BigDecimal priceTolerance;
    private final boolean skipZeroQuantityRows;
    private final Map<LineStatus, String> statusLabels;

    public ReconciliationSettings(BigDecimal quantityTolerance, BigDecimal priceTolerance,
            boolean skipZeroQuantityRows, Map<LineStatus, String> statusLabels) {
        Objects.requireNonNull(quantityTolerance, "quantityTolerance");
        Objects.requireNonNull(priceTolerance, "priceTolerance");
        if (quantityTolerance.signum() < 0 || priceTolerance.signum() < 0) {
            throw new IllegalArgumentException("Tolerances must not be negative");
        }
        EnumMap<LineStatus, String> labels = new EnumMap<>(DEFAULT_LABELS);
        if (statusLabels != null) {
            statusLabels.forEach((status, label) -> {
                if (label != null && !label.isBlank()) {
                    labels.put(status, label);
                }
            });
        }
        requireDistinctLabels(labels);
        this.quantityTolerance = quantityTolerance;
        this.priceTolerance = priceTolerance;
        this.skipZeroQuantityRows = skipZeroQuantityRows;
        this.statusLabels = Collections.unmodifiableMap(labels);
    }

    public static ReconciliationSettings defaults() {
        return new ReconciliationSettings(DEFAULT_QUANTITY_TOLERANCE, DEFAULT_PRICE_TOLERANCE, true, null);
    }

    public ReconciliationSettings withQuantityTolerance(BigDecimal tolerance) {
        return new ReconciliationSettings(tolerance, priceTolerance, skipZeroQuantityRows, statusLabels);
    }

    public ReconciliationSettings withPriceTolerance(BigDecimal tolerance) {
        return new ReconciliationSettings(quantityTolerance, tolerance, skipZeroQuantityRows, statusLabels);
    }

    public ReconciliationSettings withSkipZeroQuantityRows(boolean skip) {
        return new ReconciliationSettings(quantityTolerance, priceTolerance, skip, statusLabels);
    }

    public BigDecimal getQuantityTolerance() {
        return quantityTolerance;
    }

    public BigDecimal getPriceTolerance() {
        return priceTolerance;
    }

    public boolean isSkipZeroQuantityRows() {
        return skipZeroQuantityRows;
    }

    public Map<LineStatus, String> getStatusLabels() {
        return statusLabels;
    }

    public String labelOf(LineStatus status) {
        return statusLabels.get(status);
    }

    /**
     * Labels key the tally in reports, so each must belong to one status.
     */
    private static void requireDistinctLabels(Map<LineStatus, String> labels) {
        Map<String, LineStatus> byLabel = new HashMap<>();
        labels.forEach((status, label) -> {
            LineStatus previous = byLabel.put(label, status);
            if (previous != null) {
                throw new IllegalArgumentException("Label '" + label + "' is used for both "
                        + previous + " and " + status);
            }
        });
    }

    @Override
    public String toString() {
        return String.format("ReconciliationSettings{quantityTolerance=%s, priceTolerance=%s, skipZeroQuantityRows=%s}",
                quantityTolerance.toPlainString(), priceTolerance.toPlainString(), skipZeroQuantityRows);
    }
}
