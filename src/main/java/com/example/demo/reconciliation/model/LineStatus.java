package com.example.demo.reconciliation.model;

/**
 * Outcome of comparing one match pair. Declared in decision precedence order.
 * Display labels are configured separately and applied only when a report is
 * rendered.
 */
public enum LineStatus {
    /** Two items on the same side share a non-empty code. */
    DUPLICATE_CODE(0),

    /** No supplier-side counterpart. */
    MISSING_FROM_SUPPLIER(2),

    /** No system-side counterpart. */
    MISSING_FROM_SYSTEM(3),

    /** Counterpart found, but quantity or effective price is missing on a side. */
    PARTIAL(4),

    /** Quantity or effective price differs beyond its tolerance. */
    DEVIATION(1),

    /** Quantity and effective price both within tolerance. */
    OK(5);

    private final int reviewPriority;

    LineStatus(int reviewPriority) {
        this.reviewPriority = reviewPriority;
    }

    /**
     * Position in a report, lowest first: the lines a reviewer must act on come
     * before the ones that need no attention.
     */
    public int getReviewPriority() {
        return reviewPriority;
    }
}
