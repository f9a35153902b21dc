package com.example.demo.reconciliation.model;

import java.util.Collections;
import java.util.List;

public class MatchingResult {

    private final List<MatchPair> pairs;
    private final List<ReconciliationWarning> warnings;

    public MatchingResult(List<MatchPair> pairs, List<ReconciliationWarning> warnings) {
        this.pairs = Collections.unmodifiableList(pairs);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public List<MatchPair> getPairs() {
        return pairs;
    }

    public List<ReconciliationWarning> getWarnings() {
        return warnings;
    }

    public long countByMethod(MatchMethod method) {
        return pairs.stream()
                .filter(pair -> pair.getMethod() == method)
                .count();
    }
}
