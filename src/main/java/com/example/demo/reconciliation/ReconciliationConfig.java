package com.example.demo.reconciliation;

import com.example.demo.reconciliation.model.LineStatus;
import com.example.demo.reconciliation.model.ReconciliationSettings;
import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tolerances and status labels for reconciliation runs.
 * Each run receives an immutable snapshot of these values through
 * {@link #toSettings()}, so a run is never affected by later changes.
 */
@Configuration
@ConfigurationProperties(prefix = "app.reconciliation")
@Validated
public class ReconciliationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationConfig.class);

    /**
     * Maximum allowed absolute quantity difference. Zero requires an exact match.
     */
    @NotNull
    @DecimalMin("0")
    private BigDecimal quantityTolerance = ReconciliationSettings.DEFAULT_QUANTITY_TOLERANCE;

    /**
     * Maximum allowed absolute difference between effective unit prices.
     * Absorbs rounding on supplier invoices.
     */
    @NotNull
    @DecimalMin("0")
    private BigDecimal priceTolerance = ReconciliationSettings.DEFAULT_PRICE_TOLERANCE;

    /**
     * Drop rows whose quantity is exactly zero while aggregating documents.
     */
    private boolean skipZeroQuantityRows = true;

    /**
     * Display label per status, used verbatim in reports. Statuses not listed
     * keep their default label.
     */
    private Map<LineStatus, String> statusLabels = new LinkedHashMap<>();

    @PostConstruct
    void logEffectiveSettings() {
        logger.info("Reconciliation configured: {}", toSettings());
    }

    public ReconciliationSettings toSettings() {
        return new ReconciliationSettings(quantityTolerance, priceTolerance, skipZeroQuantityRows, statusLabels);
    }

    // Getters and setters
    public BigDecimal getQuantityTolerance() {
        return quantityTolerance;
    }

    public void setQuantityTolerance(BigDecimal quantityTolerance) {
        this.quantityTolerance = quantityTolerance;
    }

    public BigDecimal getPriceTolerance() {
        return priceTolerance;
    }

    public void setPriceTolerance(BigDecimal priceTolerance) {
        this.priceTolerance = priceTolerance;
    }

    public boolean isSkipZeroQuantityRows() {
        return skipZeroQuantityRows;
    }

    public void setSkipZeroQuantityRows(boolean skipZeroQuantityRows) {
        this.skipZeroQuantityRows = skipZeroQuantityRows;
    }

    public Map<LineStatus, String> getStatusLabels() {
        return statusLabels;
    }

    public void setStatusLabels(Map<LineStatus, String> statusLabels) {
        this.statusLabels = statusLabels;
    }
}
