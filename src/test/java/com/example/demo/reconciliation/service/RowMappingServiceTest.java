package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CanonicalField;
import com.example.demo.reconciliation.model.LineItem;
import com.example.demo.reconciliation.model.SourceDocument;
import com.example.demo.reconciliation.model.TabularDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RowMappingServiceTest {

    private RowMappingService service;

    @BeforeEach
    void setUp() {
        service = new RowMappingService();
    }

    @Test
    void testToSourceDocument_DutchHeaders() {
        // Arrange
        TabularDocument document = new TabularDocument("factuur-2024-001.pdf",
                Arrays.asList("Artikelcode", "Omschrijving", "Aantal", "Prijs", "Totaal", "BTW"),
                List.of(Arrays.asList("A001", "Schroef 4x40", "100", "0,12", "12,00", "21%")));

        // Act
        SourceDocument result = service.toSourceDocument(document);

        // Assert
        assertEquals("factuur-2024-001.pdf", result.getName());
        assertEquals(1, result.getRows().size());
        LineItem row = result.getRows().get(0);
        assertEquals("A001", row.getItemCode());
        assertEquals("Schroef 4x40", row.getItemName());
        assertDecimal("100", row.getQuantity());
        assertDecimal("0.12", row.getUnitPrice());
        assertDecimal("12.00", row.getLineTotal());
        assertDecimal("21", row.getTaxRate());
    }

    @Test
    void testToSourceDocument_EnglishHeadersInAnyOrder() {
        // Arrange
        TabularDocument document = new TabularDocument("invoice.csv",
                Arrays.asList(" QTY ", "Description", "SKU", "Unit_Price"),
                List.of(Arrays.asList("3", "Widget", "W-1", "€ 9.95")));

        // Act
        LineItem row = service.toSourceDocument(document).getRows().get(0);

        // Assert
        assertEquals("W-1", row.getItemCode());
        assertEquals("Widget", row.getItemName());
        assertDecimal("3", row.getQuantity());
        assertDecimal("9.95", row.getUnitPrice());
        assertNull(row.getLineTotal());
        assertNull(row.getTaxRate());
    }

    @Test
    void testToSourceDocument_TextColumnsNotParsedAsNumbers() {
        // Arrange
        TabularDocument document = new TabularDocument("invoice.csv",
                Arrays.asList("code", "name", "quantity"),
                List.of(Arrays.asList("00123", "1.000", "1.000")));

        // Act
        LineItem row = service.toSourceDocument(document).getRows().get(0);

        // Assert
        assertEquals("00123", row.getItemCode());
        assertEquals("1.000", row.getItemName());
        assertDecimal("1.000", row.getQuantity());
    }

    @Test
    void testToSourceDocument_UnknownColumnsIgnored() {
        // Arrange
        TabularDocument document = new TabularDocument("invoice.csv",
                Arrays.asList("Regel", "Naam", "Opmerking"),
                List.of(Arrays.asList("1", "Bolt", "urgent")));

        // Act
        LineItem row = service.toSourceDocument(document).getRows().get(0);

        // Assert
        assertNull(row.getItemCode());
        assertEquals("Bolt", row.getItemName());
        assertNull(row.getQuantity());
    }

    @Test
    void testToSourceDocument_BlankAndUnparsableCellsBecomeAbsent() {
        // Arrange
        TabularDocument document = new TabularDocument("invoice.csv",
                Arrays.asList("code", "name", "quantity", "price"),
                List.of(Arrays.asList("  ", "Bolt", "n/a", "")));

        // Act
        LineItem row = service.toSourceDocument(document).getRows().get(0);

        // Assert
        assertNull(row.getItemCode());
        assertNull(row.getQuantity());
        assertNull(row.getUnitPrice());
    }

    @Test
    void testToSourceDocument_ShortRowsTolerated() {
        // Arrange
        TabularDocument document = new TabularDocument("invoice.csv",
                Arrays.asList("name", "quantity", "price"),
                List.of(List.of("Bolt")));

        // Act
        LineItem row = service.toSourceDocument(document).getRows().get(0);

        // Assert
        assertEquals("Bolt", row.getItemName());
        assertNull(row.getQuantity());
        assertNull(row.getUnitPrice());
    }

    @Test
    void testToSourceDocument_BlankRowsSkipped() {
        // Arrange
        TabularDocument document = new TabularDocument("invoice.csv",
                Arrays.asList("name", "quantity"),
                Arrays.asList(
                        Arrays.asList("Bolt", "1"),
                        Arrays.asList("", "  "),
                        Arrays.asList("Nut", "2")));

        // Act
        SourceDocument result = service.toSourceDocument(document);

        // Assert
        assertEquals(2, result.getRows().size());
        assertEquals("Nut", result.getRows().get(1).getItemName());
    }

    @Test
    void testToSourceDocument_NoNameColumn_YieldsNoRows() {
        // Arrange
        TabularDocument document = new TabularDocument("scan.pdf",
                Arrays.asList("code", "quantity"),
                List.of(Arrays.asList("A001", "5")));

        // Act
        SourceDocument result = service.toSourceDocument(document);

        // Assert
        assertEquals("scan.pdf", result.getName());
        assertTrue(result.getRows().isEmpty());
    }

    @Test
    void testResolveColumns_FirstMatchingColumnWins() {
        // Act
        Map<CanonicalField, Integer> columns = service.resolveColumns(
                Arrays.asList("Omschrijving", "Description", "Bedrag", "Totaal"));

        // Assert
        assertEquals(0, columns.get(CanonicalField.ITEM_NAME));
        assertEquals(2, columns.get(CanonicalField.LINE_TOTAL));
        assertEquals(2, columns.size());
    }

    @Test
    void testToSourceDocuments_KeepsDocumentOrder() {
        // Arrange
        List<TabularDocument> documents = Arrays.asList(
                new TabularDocument("b.pdf", List.of("name"), List.of(List.of("Bolt"))),
                new TabularDocument("a.pdf", List.of("name"), List.of(List.of("Nut"))));

        // Act
        List<SourceDocument> result = service.toSourceDocuments(documents);

        // Assert
        assertEquals("b.pdf", result.get(0).getName());
        assertEquals("a.pdf", result.get(1).getName());
        assertTrue(service.toSourceDocuments(null).isEmpty());
    }

    @Test
    void testParseNumber_EuropeanAndEnglishNotation() {
        assertDecimal("1234.56", RowMappingService.parseNumber("1.234,56"));
        assertDecimal("1234.56", RowMappingService.parseNumber("1,234.56"));
        assertDecimal("12.5", RowMappingService.parseNumber("12,5"));
        assertDecimal("12.5", RowMappingService.parseNumber("12.5"));
        assertDecimal("1234567", RowMappingService.parseNumber("1,234,567"));
        assertDecimal("1234567", RowMappingService.parseNumber("1.234.567"));
    }

    @Test
    void testParseNumber_SymbolsAndSpacesStripped() {
        assertDecimal("10.00", RowMappingService.parseNumber("€ 10,00"));
        assertDecimal("21", RowMappingService.parseNumber("21 %"));
        assertDecimal("1234.50", RowMappingService.parseNumber("1 234,50"));
        assertDecimal("-5", RowMappingService.parseNumber("-5"));
    }

    @Test
    void testParseNumber_InvalidInput_ReturnsNull() {
        assertNull(RowMappingService.parseNumber(null));
        assertNull(RowMappingService.parseNumber(""));
        assertNull(RowMappingService.parseNumber("  "));
        assertNull(RowMappingService.parseNumber("€"));
        assertNull(RowMappingService.parseNumber("twelve"));
    }

    @Test
    void testFromHeader_CaseAndWhitespaceInsensitive() {
        assertEquals(Optional.of(CanonicalField.QUANTITY), CanonicalField.fromHeader("  Aantal "));
        assertEquals(Optional.of(CanonicalField.TAX_RATE), CanonicalField.fromHeader("BTW%"));
        assertEquals(Optional.of(CanonicalField.ITEM_CODE), CanonicalField.fromHeader("Artikel"));
        assertEquals(Optional.empty(), CanonicalField.fromHeader("Opmerking"));
        assertEquals(Optional.empty(), CanonicalField.fromHeader(null));
    }

    @Test
    void testCanonicalField_NumericFields() {
        assertFalse(CanonicalField.ITEM_CODE.isNumeric());
        assertFalse(CanonicalField.ITEM_NAME.isNumeric());
        assertTrue(CanonicalField.QUANTITY.isNumeric());
        assertTrue(CanonicalField.TAX_RATE.isNumeric());
    }

    // Helper methods

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertNotNull(actual, "expected " + expected + " but was null");
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }
}
