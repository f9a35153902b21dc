package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.AggregationResult;
import com.example.demo.reconciliation.model.LineItem;
import com.example.demo.reconciliation.model.ReconciliationSettings;
import com.example.demo.reconciliation.model.ReconciliationWarning;
import com.example.demo.reconciliation.model.Side;
import com.example.demo.reconciliation.model.SourceDocument;
import com.example.demo.reconciliation.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Merges the documents of one side into a single deduplicated item list.
 * Rows describing the same article are grouped by identity key (the item code
 * when present, otherwise the normalized item name) in first-seen order, then
 * each group is folded into one item.
 */
@Service
public class DocumentAggregationService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAggregationService.class);

    /**
     * Aggregates the documents of one side. Never fails on bad data: empty
     * documents, invalid rows and price conflicts become warnings. When no
     * document contributes a row the result has no processed documents and it is
     * up to the caller to treat that as fatal.
     *
     * @param documents documents in the order they were supplied
     * @param side      the side the documents belong to, used in messages
     * @param settings  settings of the current run
     * @return merged items with counts and warnings
     */
    public AggregationResult aggregate(List<SourceDocument> documents, Side side, ReconciliationSettings settings) {
        List<SourceDocument> input = documents != null ? documents : Collections.emptyList();

        Map<String, List<LineItem>> groups = new LinkedHashMap<>();
        List<String> documentNames = new ArrayList<>();
        List<String> skippedDocumentNames = new ArrayList<>();
        int inputRowCount = 0;
        int invalidRows = 0;
        int zeroQuantityRows = 0;

        for (int i = 0; i < input.size(); i++) {
            SourceDocument document = input.get(i);
            String documentName = documentName(document, i);
            List<LineItem> rows = document != null && document.getRows() != null
                    ? document.getRows()
                    : Collections.emptyList();
            inputRowCount += rows.size();

            int accepted = 0;
            for (LineItem row : rows) {
                if (!isValid(row)) {
                    invalidRows++;
                    continue;
                }
                if (settings.isSkipZeroQuantityRows() && row.getQuantity() != null
                        && row.getQuantity().signum() == 0) {
                    zeroQuantityRows++;
                    continue;
                }
                groups.computeIfAbsent(identityKey(row), k -> new ArrayList<>()).add(row);
                accepted++;
            }

            if (accepted == 0) {
                skippedDocumentNames.add(documentName);
            } else {
                documentNames.add(documentName);
            }
        }

        List<ReconciliationWarning> warnings = new ArrayList<>();
        if (!skippedDocumentNames.isEmpty()) {
            warnings.add(new ReconciliationWarning(WarningType.EMPTY_DOCUMENTS,
                    String.format("%d %s document(s) were empty and were skipped: %s",
                            skippedDocumentNames.size(), side.getLabel(),
                            String.join(", ", skippedDocumentNames))));
        }
        if (invalidRows > 0) {
            warnings.add(new ReconciliationWarning(WarningType.INVALID_ROWS,
                    String.format("%d %s row(s) without item name or with a negative quantity were skipped",
                            invalidRows, side.getLabel())));
        }
        if (zeroQuantityRows > 0) {
            warnings.add(new ReconciliationWarning(WarningType.ZERO_QUANTITY_ROWS,
                    String.format("%d %s row(s) with quantity 0 were skipped", zeroQuantityRows, side.getLabel())));
        }

        List<LineItem> items = new ArrayList<>(groups.size());
        for (List<LineItem> group : groups.values()) {
            items.add(group.size() == 1 ? LineItem.copyOf(group.get(0)) : merge(group, side, warnings));
        }

        logger.info("Aggregated {} {} document(s) ({} skipped): {} rows in, {} items out, {} warning(s)",
                input.size(), side.getLabel(), skippedDocumentNames.size(), inputRowCount, items.size(),
                warnings.size());

        return new AggregationResult(side, items, input.size(), inputRowCount, documentNames,
                skippedDocumentNames, warnings);
    }

    /**
     * Identity of the article a row describes. Code and name keys live in
     * separate namespaces so a code can never collide with a name.
     */
    static String identityKey(LineItem row) {
        if (row.hasCode()) {
            return "code:" + row.getItemCode().trim();
        }
        return "name:" + row.getNormalizedName();
    }

    private boolean isValid(LineItem row) {
        if (row == null || row.getNormalizedName().isEmpty()) {
            return false;
        }
        return row.getQuantity() == null || row.getQuantity().signum() >= 0;
    }

    /**
     * Folds the rows of one article: quantities are summed and unit prices
     * averaged without weighting. The line total is recomputed from the result.
     */
    private LineItem merge(List<LineItem> group, Side side, List<ReconciliationWarning> warnings) {
        LineItem first = group.get(0);

        BigDecimal quantity = null;
        for (LineItem row : group) {
            if (row.getQuantity() != null) {
                quantity = quantity == null ? row.getQuantity() : quantity.add(row.getQuantity());
            }
        }

        List<BigDecimal> prices = group.stream()
                .map(LineItem::getUnitPrice)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        BigDecimal meanPrice = null;
        if (!prices.isEmpty()) {
            BigDecimal sum = prices.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            meanPrice = sum.divide(BigDecimal.valueOf(prices.size()), MathContext.DECIMAL64);

            // TreeSet orders by compareTo, so 15.0 and 15.00 count as one price
            SortedSet<BigDecimal> distinctPrices = new TreeSet<>(prices);
            if (distinctPrices.size() > 1) {
                String listed = String.join(", ", Amounts.distinctMoney(distinctPrices));
                warnings.add(new ReconciliationWarning(WarningType.PRICE_CONFLICT,
                        String.format("Item %s has different prices across %s documents (%s); "
                                + "the average price %s was used",
                                describe(first), side.getLabel(), listed, Amounts.money(meanPrice))));
            }
        }

        BigDecimal lineTotal = quantity != null && meanPrice != null ? quantity.multiply(meanPrice) : null;

        logger.debug("Merged {} rows into {}", group.size(), first);

        return new LineItem(first.getItemCode(), first.getItemName(), quantity, meanPrice, lineTotal,
                mostFrequentTaxRate(group));
    }

    /**
     * Most frequent tax rate among the rows, the first seen one on ties.
     */
    private BigDecimal mostFrequentTaxRate(List<LineItem> group) {
        Map<BigDecimal, Integer> frequencies = new LinkedHashMap<>();
        for (LineItem row : group) {
            if (row.getTaxRate() != null) {
                frequencies.merge(row.getTaxRate().stripTrailingZeros(), 1, Integer::sum);
            }
        }

        BigDecimal mostFrequent = null;
        int highest = 0;
        for (Map.Entry<BigDecimal, Integer> entry : frequencies.entrySet()) {
            if (entry.getValue() > highest) {
                mostFrequent = entry.getKey();
                highest = entry.getValue();
            }
        }
        return mostFrequent;
    }

    private static String describe(LineItem item) {
        return item.hasCode()
                ? item.getItemCode() + " (" + item.getItemName() + ")"
                : "'" + item.getItemName() + "'";
    }

    private static String documentName(SourceDocument document, int index) {
        if (document == null || document.getName() == null || document.getName().isBlank()) {
            return "document " + (index + 1);
        }
        return document.getName();
    }
}
