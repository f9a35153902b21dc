package com.example.demo.reconciliation.controller;

import com.example.demo.reconciliation.ReconciliationConfig;
import com.example.demo.reconciliation.model.ReconciliationReport;
import com.example.demo.reconciliation.model.ReconciliationRequest;
import com.example.demo.reconciliation.model.ReconciliationResponse;
import com.example.demo.reconciliation.model.SourceDocument;
import com.example.demo.reconciliation.model.TabularReconciliationRequest;
import com.example.demo.reconciliation.service.ReconciliationService;
import com.example.demo.reconciliation.service.ReconciliationService.NoValidDocumentsException;
import com.example.demo.reconciliation.service.RowMappingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for reconciling supplier invoices against goods-received
 * records.
 */
@RestController
@RequestMapping("/api/v1/reconciliations")
public class ReconciliationController {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationController.class);

    private final ReconciliationService reconciliationService;
    private final RowMappingService rowMappingService;
    private final ReconciliationConfig config;
    private final Counter approvableCounter;
    private final Counter reviewCounter;

    public ReconciliationController(
            ReconciliationService reconciliationService,
            RowMappingService rowMappingService,
            ReconciliationConfig config,
            MeterRegistry meterRegistry) {
        this.reconciliationService = reconciliationService;
        this.rowMappingService = rowMappingService;
        this.config = config;

        this.approvableCounter = Counter.builder("reconciliation.invoice.approvable")
                .description("Reconciliations in which every line matched")
                .register(meterRegistry);

        this.reviewCounter = Counter.builder("reconciliation.invoice.review")
                .description("Reconciliations with at least one line needing review")
                .register(meterRegistry);
    }

    /**
     * Reconcile documents already in the canonical row shape.
     *
     * POST /api/v1/reconciliations
     *
     * // @formatter:off
     * Example request:
     * {
     *   "systemDocuments": [
     *     {"name": "delivery-01.pdf", "rows": [
     *       {"itemCode": "ART-001", "itemName": "Widget", "quantity": 10, "unitPrice": 15.00}
     *     ]}
     *   ],
     *   "supplierDocuments": [
     *     {"name": "invoice-2024-118.pdf", "rows": [
     *       {"itemCode": "ART-001", "itemName": "Widget", "quantity": 10, "lineTotal": 150.00}
     *     ]}
     *   ]
     * }
     * // @formatter:on
     */
    @PostMapping
    public ResponseEntity<ReconciliationResponse> reconcile(@Valid @RequestBody ReconciliationRequest request) {
        logger.info("Received reconciliation request: {} system, {} supplier document(s)",
                request.getSystemDocuments().size(), request.getSupplierDocuments().size());

        return ResponseEntity.ok(run(request.getSystemDocuments(), request.getSupplierDocuments()));
    }

    /**
     * Reconcile documents delivered as header row plus string cells. Column names
     * are mapped onto the canonical fields before reconciling.
     *
     * POST /api/v1/reconciliations/tabular
     *
     * // @formatter:off
     * Example request:
     * {
     *   "systemDocuments": [
     *     {"name": "export.csv", "headers": ["Artikelcode", "Omschrijving", "Aantal", "Prijs"],
     *      "rows": [["ART-001", "Widget", "10", "15,00"]]}
     *   ],
     *   "supplierDocuments": [...]
     * }
     * // @formatter:on
     */
    @PostMapping("/tabular")
    public ResponseEntity<ReconciliationResponse> reconcileTabular(
            @Valid @RequestBody TabularReconciliationRequest request) {
        logger.info("Received tabular reconciliation request: {} system, {} supplier document(s)",
                request.getSystemDocuments().size(), request.getSupplierDocuments().size());

        return ResponseEntity.ok(run(
                rowMappingService.toSourceDocuments(request.getSystemDocuments()),
                rowMappingService.toSourceDocuments(request.getSupplierDocuments())));
    }

    /**
     * Health check endpoint to verify service status.
     *
     * GET /api/v1/reconciliations/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(new HealthStatus("UP", "Reconciliation service is operational"));
    }

    private ReconciliationResponse run(List<SourceDocument> systemDocuments, List<SourceDocument> supplierDocuments) {
        ReconciliationReport report = reconciliationService.reconcile(systemDocuments, supplierDocuments,
                config.toSettings());

        if (report.getSummary().isFullyMatched()) {
            approvableCounter.increment();
        } else {
            reviewCounter.increment();
        }
        return ReconciliationResponse.from(report);
    }

    @ExceptionHandler(NoValidDocumentsException.class)
    public ResponseEntity<ErrorResponse> handleNoValidDocuments(NoValidDocumentsException e) {
        logger.warn("Reconciliation rejected: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("NO_VALID_DOCUMENTS", e.getMessage()));
    }

    /**
     * Global exception handler for validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String errorMessage = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Validation failed");

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", errorMessage));
    }

    /**
     * Global exception handler for unexpected errors.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpectedException(Exception e) {
        logger.error("Unexpected error", e);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    /**
     * Health status response.
     */
    public static class HealthStatus {
        private final String status;
        private final String message;

        public HealthStatus(String status, String message) {
            this.status = status;
            this.message = message;
        }

        public String getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private final String errorCode;
        private final String errorMessage;

        public ErrorResponse(String errorCode, String errorMessage) {
            this.errorCode = errorCode;
            this.errorMessage = errorMessage;
        }

        public String getErrorCode() {
            return errorCode;
        }

        public String getErrorMessage() {
            return errorMessage;
        }
    }
}
