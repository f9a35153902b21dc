package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.*;
import com.example.demo.reconciliation.service.ReconciliationService.NoValidDocumentsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for a complete reconciliation run over real aggregation, matching and
 * comparison.
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    @Mock
    private ReconciliationAuditLogger auditLogger;

    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        service = new ReconciliationService(
                new DocumentAggregationService(),
                new ItemMatchingService(),
                new LineComparisonService(),
                auditLogger);
    }

    @Test
    void testReconcile_ClassifiesEveryLine() {
        // Act
        ReconciliationReport report = service.reconcile(systemDocuments(), supplierDocuments(),
                ReconciliationSettings.defaults());

        // Assert
        assertEquals(4, report.getResults().size());
        Map<String, LineStatus> statusByCode = report.getResults().stream()
                .collect(Collectors.toMap(LineResult::getItemCode, LineResult::getStatus));
        assertEquals(LineStatus.OK, statusByCode.get("A001"));
        assertEquals(LineStatus.DEVIATION, statusByCode.get("B002"));
        assertEquals(LineStatus.MISSING_FROM_SUPPLIER, statusByCode.get("C003"));
        assertEquals(LineStatus.MISSING_FROM_SYSTEM, statusByCode.get("D004"));

        LineResult widget = report.getResults().stream()
                .filter(r -> "A001".equals(r.getItemCode()))
                .findFirst()
                .orElseThrow();
        assertEquals(0, new BigDecimal("10").compareTo(widget.getSystemQuantity()));
    }

    @Test
    void testReconcile_ResultsSortedByReviewPriority() {
        // Act
        ReconciliationReport report = service.reconcile(systemDocuments(), supplierDocuments(),
                ReconciliationSettings.defaults());

        // Assert
        List<LineStatus> statuses = report.getResults().stream()
                .map(LineResult::getStatus)
                .collect(Collectors.toList());
        assertEquals(Arrays.asList(LineStatus.DEVIATION, LineStatus.MISSING_FROM_SUPPLIER,
                LineStatus.MISSING_FROM_SYSTEM, LineStatus.OK), statuses);
    }

    @Test
    void testReconcile_Summary() {
        // Act
        ReconciliationReport report = service.reconcile(systemDocuments(), supplierDocuments(),
                ReconciliationSettings.defaults());

        // Assert
        ReconciliationSummary summary = report.getSummary();
        assertEquals(4, summary.getTotalLines());
        assertEquals(1, summary.getCount(LineStatus.OK));
        assertEquals(1, summary.getCount(LineStatus.DEVIATION));
        assertEquals(1, summary.getCount(LineStatus.MISSING_FROM_SUPPLIER));
        assertEquals(1, summary.getCount(LineStatus.MISSING_FROM_SYSTEM));
        assertEquals(0, summary.getCount(LineStatus.PARTIAL));
        assertEquals(0, summary.getCount(LineStatus.DUPLICATE_CODE));
        assertEquals(LineStatus.values().length, summary.getStatusCounts().size());
        assertEquals(2, summary.getMatchedByCode());
        assertEquals(0, summary.getMatchedByName());
        assertFalse(summary.isFullyMatched());
        assertTrue(summary.getTotalProcessingTimeMs() >= 0);
    }

    @Test
    void testReconcile_SurfacesAggregationResultsUnmodified() {
        // Act
        ReconciliationReport report = service.reconcile(systemDocuments(), supplierDocuments(),
                ReconciliationSettings.defaults());

        // Assert
        AggregationResult system = report.getSystemAggregation();
        assertEquals(3, system.getDocumentCount());
        assertEquals(2, system.getProcessedDocumentCount());
        assertEquals(4, system.getInputRowCount());
        assertEquals(3, system.getOutputItemCount());
        assertEquals(Arrays.asList("delivery-1.pdf", "delivery-2.pdf"), system.getDocumentNames());
        assertEquals(Collections.singletonList(WarningType.EMPTY_DOCUMENTS),
                system.getWarnings().stream().map(ReconciliationWarning::getType).collect(Collectors.toList()));

        AggregationResult supplier = report.getSupplierAggregation();
        assertEquals(1, supplier.getDocumentCount());
        assertEquals(3, supplier.getOutputItemCount());
        assertTrue(report.getMatchingWarnings().isEmpty());
    }

    @Test
    void testReconcile_TolerancesApplyPerRun() {
        // Act
        ReconciliationReport strict = service.reconcile(systemDocuments(), supplierDocuments(),
                ReconciliationSettings.defaults());
        ReconciliationReport lenient = service.reconcile(systemDocuments(), supplierDocuments(),
                ReconciliationSettings.defaults().withQuantityTolerance(new BigDecimal("10")));

        // Assert
        assertEquals(1, strict.getSummary().getCount(LineStatus.OK));
        assertEquals(2, lenient.getSummary().getCount(LineStatus.OK));
        assertEquals(0, lenient.getSummary().getCount(LineStatus.DEVIATION));
    }

    @Test
    void testReconcile_AllLinesMatch_FullyMatched() {
        // Arrange
        List<SourceDocument> system = List.of(new SourceDocument("delivery.pdf",
                List.of(item("A001", "Widget", "10", "10.00"))));
        List<SourceDocument> supplier = List.of(new SourceDocument("invoice.pdf",
                List.of(item(null, "WIDGET", "10", "10.00"))));

        // Act
        ReconciliationReport report = service.reconcile(system, supplier, ReconciliationSettings.defaults());

        // Assert
        assertTrue(report.getSummary().isFullyMatched());
        assertEquals(1, report.getSummary().getMatchedByName());
        verify(auditLogger).logStart(eq(1), eq(1), any());
        verify(auditLogger).logCompleted(report);
    }

    @Test
    void testReconcile_NoValidSystemDocuments_Rejected() {
        // Arrange
        List<SourceDocument> system = List.of(new SourceDocument("empty.pdf", new ArrayList<>()));

        // Act
        NoValidDocumentsException e = assertThrows(NoValidDocumentsException.class,
                () -> service.reconcile(system, supplierDocuments(), ReconciliationSettings.defaults()));

        // Assert
        assertEquals(Side.SYSTEM, e.getSide());
        assertEquals(1, e.getDocumentCount());
        verify(auditLogger).logRejected(Side.SYSTEM, 1);
        verify(auditLogger, never()).logCompleted(any());
    }

    @Test
    void testReconcile_NoSupplierDocuments_Rejected() {
        // Act
        NoValidDocumentsException e = assertThrows(NoValidDocumentsException.class,
                () -> service.reconcile(systemDocuments(), Collections.emptyList(),
                        ReconciliationSettings.defaults()));

        // Assert
        assertEquals(Side.SUPPLIER, e.getSide());
        verify(auditLogger).logRejected(eq(Side.SUPPLIER), anyInt());
    }

    @Test
    void testReconcile_PartialLine() {
        // Arrange
        List<SourceDocument> system = List.of(new SourceDocument("delivery.pdf",
                List.of(item("A001", "Widget", null, "10.00"))));
        List<SourceDocument> supplier = List.of(new SourceDocument("invoice.pdf",
                List.of(item("A001", "Widget", "10", null))));

        // Act
        ReconciliationReport report = service.reconcile(system, supplier, ReconciliationSettings.defaults());

        // Assert
        assertEquals(LineStatus.PARTIAL, report.getResults().get(0).getStatus());
        assertEquals(1, report.getSummary().getCount(LineStatus.PARTIAL));
    }

    @Test
    void testReconcile_AmbiguousNameMatch_Surfaced() {
        // Arrange: the supplier lists the same unnamed article on two invoices with different codes
        List<SourceDocument> system = List.of(new SourceDocument("delivery.pdf",
                List.of(item(null, "Widget", "2", "1.00"))));
        List<SourceDocument> supplier = List.of(
                new SourceDocument("invoice-1.pdf", List.of(item("X1", "Widget", "1", "1.00"))),
                new SourceDocument("invoice-2.pdf", List.of(item("X2", "widget", "1", "1.00"))));

        // Act
        ReconciliationReport report = service.reconcile(system, supplier, ReconciliationSettings.defaults());

        // Assert
        assertEquals(1, report.getMatchingWarnings().size());
        assertEquals(WarningType.AMBIGUOUS_NAME_MATCH, report.getMatchingWarnings().get(0).getType());
        assertEquals(2, report.getResults().size());
    }

    // Helper methods

    /**
     * Two delivery notes for the same widget, plus an empty one.
     */
    private static List<SourceDocument> systemDocuments() {
        return Arrays.asList(
                new SourceDocument("delivery-1.pdf", Arrays.asList(
                        item("A001", "Widget", "6", "10.00"),
                        item("B002", "Bolt", "100", "0.10"))),
                new SourceDocument("delivery-2.pdf", Arrays.asList(
                        item("A001", "Widget", "4", "10.00"),
                        item("C003", "Nut", "50", "0.05"))),
                new SourceDocument("delivery-3.pdf", new ArrayList<>()));
    }

    private static List<SourceDocument> supplierDocuments() {
        LineItem widget = new LineItem("A001", "Widget", new BigDecimal("10"), null, new BigDecimal("100.10"), null);
        return Collections.singletonList(new SourceDocument("invoice.pdf", Arrays.asList(
                widget,
                item("B002", "Bolt", "90", "0.10"),
                item("D004", "Washer", "20", "0.02"))));
    }

    private static LineItem item(String code, String name, String quantity, String unitPrice) {
        return new LineItem(code, name,
                quantity != null ? new BigDecimal(quantity) : null,
                unitPrice != null ? new BigDecimal(unitPrice) : null);
    }
}
