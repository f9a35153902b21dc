package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.LineItem;
import com.example.demo.reconciliation.model.LineResult;
import com.example.demo.reconciliation.model.LineStatus;
import com.example.demo.reconciliation.model.MatchPair;
import com.example.demo.reconciliation.model.ReconciliationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides the status of one match pair.
 *
 * <p>Only the final quantity and the effective unit price decide whether a line
 * is acceptable. Gross prices, discounts, line totals, tax rates and textual
 * differences in name or code are carried along for context but never cause a
 * deviation on their own.
 */
@Service
public class LineComparisonService {

    private static final Logger logger = LoggerFactory.getLogger(LineComparisonService.class);

    static final String MATCH_EXPLANATION = "Quantity and price match";
    static final String MISSING_FROM_SUPPLIER_EXPLANATION = "Line is in the system but not on the supplier invoice";
    static final String MISSING_FROM_SYSTEM_EXPLANATION = "Line is on the supplier invoice but not in the system";

    /**
     * Compares one pair under the tolerances of the current run.
     *
     * @param pair     the pair produced by the matcher
     * @param settings settings of the current run
     * @return the result row for the pair, never {@code null}
     */
    public LineResult compare(MatchPair pair, ReconciliationSettings settings) {
        LineItem systemItem = pair.getSystemItem();
        LineItem supplierItem = pair.getSupplierItem();
        BigDecimal systemPrice = systemItem != null ? effectivePrice(systemItem) : null;
        BigDecimal supplierPrice = supplierItem != null ? effectivePrice(supplierItem) : null;

        if (pair.isDuplicateCode()) {
            return new LineResult(LineStatus.DUPLICATE_CODE, pair.getMethod(), systemItem, null,
                    systemPrice, null,
                    "Item code " + systemItem.getItemCode() + " appears more than once in the system data");
        }
        if (supplierItem == null) {
            return new LineResult(LineStatus.MISSING_FROM_SUPPLIER, pair.getMethod(), systemItem, null,
                    systemPrice, null, MISSING_FROM_SUPPLIER_EXPLANATION);
        }
        if (systemItem == null) {
            return new LineResult(LineStatus.MISSING_FROM_SYSTEM, pair.getMethod(), null, supplierItem,
                    null, supplierPrice, MISSING_FROM_SYSTEM_EXPLANATION);
        }

        List<String> clauses = new ArrayList<>();
        boolean deviates = false;

        BigDecimal systemQuantity = systemItem.getQuantity();
        BigDecimal supplierQuantity = supplierItem.getQuantity();
        boolean quantityComparable = systemQuantity != null && supplierQuantity != null;
        if (quantityComparable) {
            if (exceeds(systemQuantity, supplierQuantity, settings.getQuantityTolerance())) {
                deviates = true;
                clauses.add(String.format("Quantity differs (expected %s, actual %s)",
                        Amounts.quantity(systemQuantity), Amounts.quantity(supplierQuantity)));
            }
        } else {
            clauses.add("Quantity could not be compared (" + missingOn(systemQuantity, supplierQuantity) + ")");
        }

        boolean priceComparable = systemPrice != null && supplierPrice != null;
        if (priceComparable) {
            if (exceeds(systemPrice, supplierPrice, settings.getPriceTolerance())) {
                deviates = true;
                clauses.add(String.format("Price differs (expected %s, actual %s, difference %s)",
                        Amounts.money(systemPrice), Amounts.money(supplierPrice),
                        Amounts.signedMoney(supplierPrice.subtract(systemPrice))));
            }
        } else {
            clauses.add("Price could not be determined (" + missingOn(systemPrice, supplierPrice) + ")");
        }

        LineStatus status;
        if (!quantityComparable || !priceComparable) {
            status = LineStatus.PARTIAL;
        } else if (deviates) {
            status = LineStatus.DEVIATION;
        } else {
            status = LineStatus.OK;
        }

        String explanation = status == LineStatus.OK ? MATCH_EXPLANATION : String.join("; ", clauses);

        logger.debug("Compared {} with {}: {}", systemItem, supplierItem, status);

        return new LineResult(status, pair.getMethod(), systemItem, supplierItem, systemPrice, supplierPrice,
                explanation);
    }

    /**
     * The single per-unit price used for every acceptability decision: the
     * explicit unit price when present, otherwise line total divided by quantity
     * when both are present and the quantity is positive, otherwise {@code null}.
     */
    public BigDecimal effectivePrice(LineItem item) {
        if (item.getUnitPrice() != null) {
            return item.getUnitPrice();
        }
        if (item.getLineTotal() != null && item.getQuantity() != null && item.getQuantity().signum() > 0) {
            return item.getLineTotal().divide(item.getQuantity(), MathContext.DECIMAL64);
        }
        return null;
    }

    private static boolean exceeds(BigDecimal expected, BigDecimal actual, BigDecimal tolerance) {
        return expected.subtract(actual).abs().compareTo(tolerance) > 0;
    }

    private static String missingOn(BigDecimal systemValue, BigDecimal supplierValue) {
        if (systemValue == null && supplierValue == null) {
            return "missing on both sides";
        }
        return systemValue == null ? "missing on the system side" : "missing on the supplier side";
    }
}
