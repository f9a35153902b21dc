package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.LineItem;
import com.example.demo.reconciliation.model.MatchMethod;
import com.example.demo.reconciliation.model.MatchPair;
import com.example.demo.reconciliation.model.MatchingResult;
import com.example.demo.reconciliation.model.ReconciliationWarning;
import com.example.demo.reconciliation.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Pairs each system item with at most one supplier item.
 *
 * <p>System items are visited in order. An item with a code is first matched on
 * exact code equality; failing that, or without a code, on normalized name. The
 * first candidate in supplier order wins and is consumed, so it cannot be paired
 * twice. Supplier items left over at the end become unmatched pairs of their own.
 */
@Service
public class ItemMatchingService {

    private static final Logger logger = LoggerFactory.getLogger(ItemMatchingService.class);

    public MatchingResult match(List<LineItem> systemItems, List<LineItem> supplierItems) {
        // Consumed marks are scoped to this call and keyed on instance identity,
        // so equal-looking rows on the supplier side stay distinct
        Set<LineItem> consumed = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<String> seenSystemCodes = new HashSet<>();

        List<MatchPair> pairs = new ArrayList<>();
        List<ReconciliationWarning> warnings = new ArrayList<>();

        for (LineItem systemItem : systemItems) {
            if (systemItem.hasCode()) {
                String code = systemItem.getItemCode().trim();
                if (!seenSystemCodes.add(code)) {
                    logger.warn("Duplicate item code on the system side, line not matched");
                    pairs.add(MatchPair.duplicateCode(systemItem));
                    continue;
                }

                Optional<LineItem> byCode = supplierItems.stream()
                        .filter(candidate -> !consumed.contains(candidate))
                        .filter(candidate -> candidate.hasCode() && candidate.getItemCode().trim().equals(code))
                        .findFirst();
                if (byCode.isPresent()) {
                    consumed.add(byCode.get());
                    pairs.add(MatchPair.matched(systemItem, byCode.get(), MatchMethod.BY_CODE));
                    continue;
                }
            }

            Optional<LineItem> byName = matchByName(systemItem, supplierItems, consumed, warnings);
            if (byName.isPresent()) {
                consumed.add(byName.get());
                pairs.add(MatchPair.matched(systemItem, byName.get(), MatchMethod.BY_NAME));
            } else {
                pairs.add(MatchPair.systemOnly(systemItem));
            }
        }

        for (LineItem supplierItem : supplierItems) {
            if (!consumed.contains(supplierItem)) {
                pairs.add(MatchPair.supplierOnly(supplierItem));
            }
        }

        logger.debug("Matched {} system and {} supplier items into {} pairs",
                systemItems.size(), supplierItems.size(), pairs.size());

        return new MatchingResult(pairs, warnings);
    }

    private Optional<LineItem> matchByName(LineItem systemItem, List<LineItem> supplierItems,
            Set<LineItem> consumed, List<ReconciliationWarning> warnings) {
        String name = systemItem.getNormalizedName();
        if (name.isEmpty()) {
            return Optional.empty();
        }

        List<LineItem> candidates = supplierItems.stream()
                .filter(candidate -> !consumed.contains(candidate))
                .filter(candidate -> name.equals(candidate.getNormalizedName()))
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        if (candidates.size() > 1) {
            warnings.add(new ReconciliationWarning(WarningType.AMBIGUOUS_NAME_MATCH,
                    String.format("'%s' matched by name to the first of %d supplier items with the same name",
                            systemItem.getItemName(), candidates.size())));
        }
        return Optional.of(candidates.get(0));
    }
}
