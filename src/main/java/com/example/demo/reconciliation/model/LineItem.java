package com.example.demo.reconciliation.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One article row in the canonical schema shared by the system and supplier
 * side. Absent values are {@code null}, never zero or an empty string.
 */
public class LineItem {

    private static final Pattern UNICODE_WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Article code. Optional; when present it identifies the article within one
     * side.
     */
    private String itemCode;

    /**
     * Required. Rows without a name are skipped during aggregation.
     */
    private String itemName;

    private BigDecimal quantity;

    private BigDecimal unitPrice;

    private BigDecimal lineTotal;

    /**
     * Informative only, never compared.
     */
    private BigDecimal taxRate;

    public LineItem() {
    }

    public LineItem(String itemCode, String itemName, BigDecimal quantity, BigDecimal unitPrice) {
        this.itemCode = itemCode;
        this.itemName = itemName;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
    }

    public LineItem(String itemCode, String itemName, BigDecimal quantity, BigDecimal unitPrice,
            BigDecimal lineTotal, BigDecimal taxRate) {
        this(itemCode, itemName, quantity, unitPrice);
        this.lineTotal = lineTotal;
        this.taxRate = taxRate;
    }

    public static LineItem copyOf(LineItem other) {
        return new LineItem(other.itemCode, other.itemName, other.quantity, other.unitPrice,
                other.lineTotal, other.taxRate);
    }

    @JsonIgnore
    public boolean hasCode() {
        return itemCode != null && !itemCode.trim().isEmpty();
    }

    @JsonIgnore
    public String getNormalizedName() {
        return normalizeName(itemName);
    }

    /**
     * Case-folds, trims and collapses internal whitespace to single spaces.
     * Unicode spaces such as the no-break space count as whitespace.
     * Returns an empty string for {@code null}.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return UNICODE_WHITESPACE.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    // Getters and setters
    public String getItemCode() {
        return itemCode;
    }

    public void setItemCode(String itemCode) {
        this.itemCode = itemCode;
    }

    public String getItemName() {
        return itemName;
    }

    public void setItemName(String itemName) {
        this.itemName = itemName;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public void setQuantity(BigDecimal quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public void setUnitPrice(BigDecimal unitPrice) {
        this.unitPrice = unitPrice;
    }

    public BigDecimal getLineTotal() {
        return lineTotal;
    }

    public void setLineTotal(BigDecimal lineTotal) {
        this.lineTotal = lineTotal;
    }

    public BigDecimal getTaxRate() {
        return taxRate;
    }

    public void setTaxRate(BigDecimal taxRate) {
        this.taxRate = taxRate;
    }

    @Override
    public String toString() {
        return "LineItem{code=" + itemCode + ", name=" + itemName + "}";
    }
}
