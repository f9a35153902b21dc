package com.example.demo.reconciliation.model;

import java.math.BigDecimal;

/**
 * Outcome of comparing one match pair. Identification fields are taken from the
 * system side when present, otherwise from the supplier side. Prices are
 * effective prices, not the raw unit prices.
 */
public final class LineResult {

    private final LineStatus status;
    private final MatchMethod matchMethod;
    private final String itemCode;
    private final String itemName;
    private final BigDecimal systemQuantity;
    private final BigDecimal supplierQuantity;
    private final BigDecimal systemPrice;
    private final BigDecimal supplierPrice;
    private final BigDecimal systemLineTotal;
    private final BigDecimal supplierLineTotal;
    private final BigDecimal systemTaxRate;
    private final BigDecimal supplierTaxRate;
    private final String explanation;

    public LineResult(LineStatus status, MatchMethod matchMethod, LineItem systemItem, LineItem supplierItem,
            BigDecimal systemPrice, BigDecimal supplierPrice, String explanation) {
        this.status = status;
        this.matchMethod = matchMethod;
        this.itemCode = systemItem != null && systemItem.hasCode()
                ? systemItem.getItemCode()
                : supplierItem != null ? supplierItem.getItemCode() : null;
        this.itemName = systemItem != null ? systemItem.getItemName() : supplierItem.getItemName();
        this.systemQuantity = systemItem != null ? systemItem.getQuantity() : null;
        this.supplierQuantity = supplierItem != null ? supplierItem.getQuantity() : null;
        this.systemPrice = systemPrice;
        this.supplierPrice = supplierPrice;
        this.systemLineTotal = systemItem != null ? systemItem.getLineTotal() : null;
        this.supplierLineTotal = supplierItem != null ? supplierItem.getLineTotal() : null;
        this.systemTaxRate = systemItem != null ? systemItem.getTaxRate() : null;
        this.supplierTaxRate = supplierItem != null ? supplierItem.getTaxRate() : null;
        this.explanation = explanation;
    }

    public LineStatus getStatus() {
        return status;
    }

    public MatchMethod getMatchMethod() {
        return matchMethod;
    }

    public String getItemCode() {
        return itemCode;
    }

    public String getItemName() {
        return itemName;
    }

    public BigDecimal getSystemQuantity() {
        return systemQuantity;
    }

    public BigDecimal getSupplierQuantity() {
        return supplierQuantity;
    }

    public BigDecimal getSystemPrice() {
        return systemPrice;
    }

    public BigDecimal getSupplierPrice() {
        return supplierPrice;
    }

    public BigDecimal getSystemLineTotal() {
        return systemLineTotal;
    }

    public BigDecimal getSupplierLineTotal() {
        return supplierLineTotal;
    }

    public BigDecimal getSystemTaxRate() {
        return systemTaxRate;
    }

    public BigDecimal getSupplierTaxRate() {
        return supplierTaxRate;
    }

    public String getExplanation() {
        return explanation;
    }
}
