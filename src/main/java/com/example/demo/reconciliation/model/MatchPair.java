package com.example.demo.reconciliation.model;

/**
 * Association between at most one system item and at most one supplier item.
 * A {@code null} side means the item has no counterpart on that side.
 */
public final class MatchPair {

    private final LineItem systemItem;
    private final LineItem supplierItem;
    private final MatchMethod method;
    private final boolean duplicateCode;

    private MatchPair(LineItem systemItem, LineItem supplierItem, MatchMethod method, boolean duplicateCode) {
        this.systemItem = systemItem;
        this.supplierItem = supplierItem;
        this.method = method;
        this.duplicateCode = duplicateCode;
    }

    public static MatchPair matched(LineItem systemItem, LineItem supplierItem, MatchMethod method) {
        return new MatchPair(systemItem, supplierItem, method, false);
    }

    public static MatchPair systemOnly(LineItem systemItem) {
        return new MatchPair(systemItem, null, MatchMethod.NONE, false);
    }

    public static MatchPair supplierOnly(LineItem supplierItem) {
        return new MatchPair(null, supplierItem, MatchMethod.NONE, false);
    }

    public static MatchPair duplicateCode(LineItem systemItem) {
        return new MatchPair(systemItem, null, MatchMethod.NONE, true);
    }

    public LineItem getSystemItem() {
        return systemItem;
    }

    public LineItem getSupplierItem() {
        return supplierItem;
    }

    public MatchMethod getMethod() {
        return method;
    }

    public boolean isDuplicateCode() {
        return duplicateCode;
    }

    @Override
    public String toString() {
        return "MatchPair{system=" + systemItem + ", supplier=" + supplierItem + ", method=" + method
                + (duplicateCode ? ", duplicateCode" : "") + "}";
    }
}
