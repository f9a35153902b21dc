package com.example.demo.reconciliation.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fields of the canonical line schema, each with the column names suppliers are
 * known to use for it. Lookups are case-insensitive and ignore surrounding
 * whitespace.
 */
public enum CanonicalField {
    ITEM_CODE("artikel", "artikelcode", "code", "product_code", "productcode", "item_code", "itemcode",
            "sku", "article"),
    ITEM_NAME("omschrijving", "artikelnaam", "beschrijving", "product", "naam", "description", "item_name",
            "itemname", "name"),
    QUANTITY("qty", "aantal", "hoeveelheid", "quantity", "aant"),
    UNIT_PRICE("price", "prijs", "prijs_per_stuk", "stukprijs", "eenheidsprijs", "unit_price", "unitprice"),
    LINE_TOTAL("total", "totaal", "totaalbedrag", "bedrag", "amount", "line_total", "linetotal"),
    TAX_RATE("btw", "btw_percentage", "btwpercentage", "vat", "tax", "btw%", "tax_rate", "vat%");

    private static final Map<String, CanonicalField> BY_SYNONYM;

    static {
        Map<String, CanonicalField> bySynonym = new HashMap<>();
        for (CanonicalField field : values()) {
            for (String synonym : field.synonyms) {
                CanonicalField previous = bySynonym.put(synonym, field);
                if (previous != null) {
                    throw new IllegalStateException("Synonym '" + synonym + "' maps to both "
                            + previous + " and " + field);
                }
            }
        }
        BY_SYNONYM = Collections.unmodifiableMap(bySynonym);
    }

    private final List<String> synonyms;

    CanonicalField(String... synonyms) {
        this.synonyms = Collections.unmodifiableList(Arrays.asList(synonyms));
    }

    public List<String> getSynonyms() {
        return synonyms;
    }

    public boolean isNumeric() {
        return this != ITEM_CODE && this != ITEM_NAME;
    }

    public static Optional<CanonicalField> fromHeader(String header) {
        if (header == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SYNONYM.get(header.trim().toLowerCase(Locale.ROOT)));
    }
}
