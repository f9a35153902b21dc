package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.AggregationResult;
import com.example.demo.reconciliation.model.LineStatus;
import com.example.demo.reconciliation.model.ReconciliationReport;
import com.example.demo.reconciliation.model.ReconciliationSettings;
import com.example.demo.reconciliation.model.ReconciliationSummary;
import com.example.demo.reconciliation.model.Side;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Audit trail of reconciliation runs. Records counts, tolerances and timings
 * only: item codes, names and amounts never reach the audit log or the metrics.
 */
@Service
public class ReconciliationAuditLogger {

    static final String AUDIT_LOGGER_NAME = "reconciliation.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final MeterRegistry meterRegistry;
    private final Timer runTimer;
    private final Counter completedCounter;
    private final Counter rejectedCounter;

    public ReconciliationAuditLogger(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runTimer = Timer.builder("reconciliation.run.duration")
                .description("Time taken by reconciliation runs")
                .register(meterRegistry);

        this.completedCounter = Counter.builder("reconciliation.run.completed")
                .description("Number of reconciliation runs that produced a report")
                .register(meterRegistry);

        this.rejectedCounter = Counter.builder("reconciliation.run.rejected")
                .description("Number of reconciliation runs rejected for lack of valid documents")
                .register(meterRegistry);
    }

    public void logStart(int systemDocuments, int supplierDocuments, ReconciliationSettings settings) {
        audit.info("RUN START | system documents={} | supplier documents={} | quantity tolerance={} | price tolerance={}",
                systemDocuments, supplierDocuments,
                settings.getQuantityTolerance().toPlainString(), settings.getPriceTolerance().toPlainString());
    }

    public void logCompleted(ReconciliationReport report) {
        ReconciliationSummary summary = report.getSummary();
        AggregationResult system = report.getSystemAggregation();
        AggregationResult supplier = report.getSupplierAggregation();

        audit.info("RUN COMPLETE | system docs={}/{} rows={} items={} | supplier docs={}/{} rows={} items={}"
                        + " | matched by code={} by name={} | lines={} | ok={} deviation={} missing from supplier={}"
                        + " missing from system={} partial={} duplicate code={} | {} ms",
                system.getProcessedDocumentCount(), system.getDocumentCount(), system.getInputRowCount(),
                system.getOutputItemCount(),
                supplier.getProcessedDocumentCount(), supplier.getDocumentCount(), supplier.getInputRowCount(),
                supplier.getOutputItemCount(),
                summary.getMatchedByCode(), summary.getMatchedByName(), summary.getTotalLines(),
                summary.getCount(LineStatus.OK), summary.getCount(LineStatus.DEVIATION),
                summary.getCount(LineStatus.MISSING_FROM_SUPPLIER), summary.getCount(LineStatus.MISSING_FROM_SYSTEM),
                summary.getCount(LineStatus.PARTIAL), summary.getCount(LineStatus.DUPLICATE_CODE),
                summary.getTotalProcessingTimeMs());

        completedCounter.increment();
        runTimer.record(summary.getTotalProcessingTimeMs(), TimeUnit.MILLISECONDS);
        summary.getStatusCounts().forEach((status, count) -> {
            if (count > 0) {
                meterRegistry.counter("reconciliation.lines", "status", status.name()).increment(count);
            }
        });
    }

    public void logRejected(Side side, int documentCount) {
        audit.warn("RUN REJECTED | no valid {} documents | documents supplied={}", side.getLabel(), documentCount);
        rejectedCounter.increment();
    }
}
