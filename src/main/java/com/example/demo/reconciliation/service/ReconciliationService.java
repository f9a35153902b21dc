package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs a reconciliation: aggregates both sides, matches their items, compares
 * every pair and tallies the outcome.
 * Always returns a complete report unless one side has no usable document.
 */
@Service
public class ReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

    private final DocumentAggregationService aggregationService;
    private final ItemMatchingService matchingService;
    private final LineComparisonService comparisonService;
    private final ReconciliationAuditLogger auditLogger;

    public ReconciliationService(
            DocumentAggregationService aggregationService,
            ItemMatchingService matchingService,
            LineComparisonService comparisonService,
            ReconciliationAuditLogger auditLogger) {
        this.aggregationService = aggregationService;
        this.matchingService = matchingService;
        this.comparisonService = comparisonService;
        this.auditLogger = auditLogger;
    }

    /**
     * Reconciles the system documents against the supplier documents.
     *
     * @param systemDocuments   goods-received documents, in the order supplied
     * @param supplierDocuments supplier invoices, in the order supplied
     * @param settings          tolerances and labels for this run
     * @return report with one result row per match pair, sorted by review priority
     * @throws NoValidDocumentsException if either side has no document with a valid row
     */
    public ReconciliationReport reconcile(List<SourceDocument> systemDocuments,
            List<SourceDocument> supplierDocuments,
            ReconciliationSettings settings) {
        long startTime = System.currentTimeMillis();

        logger.info("Starting reconciliation of {} system and {} supplier document(s)",
                sizeOf(systemDocuments), sizeOf(supplierDocuments));
        auditLogger.logStart(sizeOf(systemDocuments), sizeOf(supplierDocuments), settings);

        // Step 1: Aggregate each side into one canonical dataset
        AggregationResult systemAggregation = aggregationService.aggregate(systemDocuments, Side.SYSTEM, settings);
        AggregationResult supplierAggregation = aggregationService.aggregate(supplierDocuments, Side.SUPPLIER,
                settings);

        requireDocuments(systemAggregation);
        requireDocuments(supplierAggregation);

        // Step 2: Pair the items of both sides
        MatchingResult matching = matchingService.match(systemAggregation.getItems(),
                supplierAggregation.getItems());

        // Step 3: Compare every pair; List.sort is stable, so equal statuses keep matching order
        List<LineResult> results = matching.getPairs().stream()
                .map(pair -> comparisonService.compare(pair, settings))
                .collect(Collectors.toCollection(ArrayList::new));
        results.sort(Comparator.comparingInt(result -> result.getStatus().getReviewPriority()));

        long totalTime = System.currentTimeMillis() - startTime;

        // Step 4: Build the summary
        ReconciliationSummary summary = buildSummary(results, matching, totalTime);

        logger.info("Completed reconciliation: {} lines, {} ok, {} deviation, {} missing from supplier, "
                        + "{} missing from system, {} partial, {} duplicate code",
                summary.getTotalLines(),
                summary.getCount(LineStatus.OK),
                summary.getCount(LineStatus.DEVIATION),
                summary.getCount(LineStatus.MISSING_FROM_SUPPLIER),
                summary.getCount(LineStatus.MISSING_FROM_SYSTEM),
                summary.getCount(LineStatus.PARTIAL),
                summary.getCount(LineStatus.DUPLICATE_CODE));

        ReconciliationReport report = new ReconciliationReport(results, summary, systemAggregation,
                supplierAggregation, matching.getWarnings(), settings);
        auditLogger.logCompleted(report);
        return report;
    }

    private void requireDocuments(AggregationResult aggregation) {
        if (aggregation.getProcessedDocumentCount() == 0) {
            logger.warn("No valid {} documents among {} supplied, reconciliation aborted",
                    aggregation.getSide().getLabel(), aggregation.getDocumentCount());
            auditLogger.logRejected(aggregation.getSide(), aggregation.getDocumentCount());
            throw new NoValidDocumentsException(aggregation.getSide(), aggregation.getDocumentCount());
        }
    }

    /**
     * Build reconciliation summary from results.
     */
    private ReconciliationSummary buildSummary(List<LineResult> results, MatchingResult matching, long totalTime) {
        Map<LineStatus, Integer> counts = new EnumMap<>(LineStatus.class);
        for (LineResult result : results) {
            counts.merge(result.getStatus(), 1, Integer::sum);
        }

        return new ReconciliationSummary(
                results.size(),
                counts,
                (int) matching.countByMethod(MatchMethod.BY_CODE),
                (int) matching.countByMethod(MatchMethod.BY_NAME),
                totalTime);
    }

    private static int sizeOf(List<?> documents) {
        return documents != null ? documents.size() : 0;
    }

    /**
     * Raised when one side has no document with a usable row. Nothing can be
     * reconciled then, so the run stops before matching.
     */
    public static class NoValidDocumentsException extends RuntimeException {

        private final Side side;
        private final int documentCount;

        public NoValidDocumentsException(Side side, int documentCount) {
            super(String.format("No valid %s documents to reconcile (%d supplied)", side.getLabel(), documentCount));
            this.side = side;
            this.documentCount = documentCount;
        }

        public Side getSide() {
            return side;
        }

        public int getDocumentCount() {
            return documentCount;
        }
    }
}
