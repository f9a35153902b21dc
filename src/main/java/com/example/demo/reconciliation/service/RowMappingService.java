package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CanonicalField;
import com.example.demo.reconciliation.model.LineItem;
import com.example.demo.reconciliation.model.SourceDocument;
import com.example.demo.reconciliation.model.TabularDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts tabular documents with supplier-specific column names into canonical
 * rows. Headers are resolved through {@link CanonicalField#fromHeader(String)};
 * the first column that resolves to a field wins and unknown columns are
 * ignored. Cells that are blank or cannot be parsed become absent values.
 */
@Service
public class RowMappingService {

    private static final Logger logger = LoggerFactory.getLogger(RowMappingService.class);

    public List<SourceDocument> toSourceDocuments(List<TabularDocument> documents) {
        if (documents == null) {
            return Collections.emptyList();
        }
        return documents.stream()
                .map(this::toSourceDocument)
                .collect(Collectors.toList());
    }

    /**
     * Maps one document. A document without an item name column yields no rows,
     * which the aggregator then reports as an empty document.
     */
    public SourceDocument toSourceDocument(TabularDocument document) {
        Map<CanonicalField, Integer> columns = resolveColumns(document.getHeaders());

        if (!columns.containsKey(CanonicalField.ITEM_NAME)) {
            logger.warn("Document '{}' has no recognizable item name column among {} header(s)",
                    document.getName(), document.getHeaders() != null ? document.getHeaders().size() : 0);
            return new SourceDocument(document.getName(), new ArrayList<>());
        }

        List<LineItem> rows = new ArrayList<>();
        if (document.getRows() != null) {
            for (List<String> cells : document.getRows()) {
                if (isBlankRow(cells)) {
                    continue;
                }
                rows.add(toLineItem(cells, columns));
            }
        }

        logger.debug("Mapped document '{}': {} column(s) recognized, {} row(s)",
                document.getName(), columns.size(), rows.size());

        return new SourceDocument(document.getName(), rows);
    }

    Map<CanonicalField, Integer> resolveColumns(List<String> headers) {
        Map<CanonicalField, Integer> columns = new EnumMap<>(CanonicalField.class);
        if (headers == null) {
            return columns;
        }
        for (int i = 0; i < headers.size(); i++) {
            int index = i;
            CanonicalField.fromHeader(headers.get(i))
                    .ifPresent(field -> columns.putIfAbsent(field, index));
        }
        return columns;
    }

    private LineItem toLineItem(List<String> cells, Map<CanonicalField, Integer> columns) {
        LineItem item = new LineItem();
        columns.forEach((field, index) -> {
            String value = text(cells, index);
            BigDecimal number = field.isNumeric() ? parseNumber(value) : null;
            switch (field) {
                case ITEM_CODE:
                    item.setItemCode(value);
                    break;
                case ITEM_NAME:
                    item.setItemName(value);
                    break;
                case QUANTITY:
                    item.setQuantity(number);
                    break;
                case UNIT_PRICE:
                    item.setUnitPrice(number);
                    break;
                case LINE_TOTAL:
                    item.setLineTotal(number);
                    break;
                case TAX_RATE:
                    item.setTaxRate(number);
                    break;
                default:
                    throw new IllegalStateException("Unmapped field " + field);
            }
        });
        return item;
    }

    private static String text(List<String> cells, Integer index) {
        if (index == null || index >= cells.size() || cells.get(index) == null) {
            return null;
        }
        String value = cells.get(index).trim();
        return value.isEmpty() ? null : value;
    }

    private static boolean isBlankRow(List<String> cells) {
        return cells == null || cells.stream().allMatch(cell -> cell == null || cell.trim().isEmpty());
    }

    /**
     * Parses a numeric cell as written on invoices: currency and percent signs
     * and spaces are dropped, and both {@code 1.234,56} and {@code 1,234.56} are
     * read as 1234.56. A single comma is a decimal separator. Returns
     * {@code null} when the cell is blank or not a number.
     */
    static BigDecimal parseNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.replace("€", "")
                .replace("%", "")
                .replaceAll("[\\s\\u00A0]", "");
        if (value.isEmpty()) {
            return null;
        }

        int lastComma = value.lastIndexOf(',');
        int lastDot = value.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            value = lastComma > lastDot
                    ? value.replace(".", "").replace(',', '.')
                    : value.replace(",", "");
        } else if (lastComma >= 0) {
            value = value.indexOf(',') == lastComma ? value.replace(',', '.') : value.replace(",", "");
        } else if (lastDot >= 0 && value.indexOf('.') != lastDot) {
            value = value.replace(".", "");
        }

        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            logger.debug("Unparsable numeric cell treated as absent");
            return null;
        }
    }
}
