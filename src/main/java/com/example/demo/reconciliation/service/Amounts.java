package com.example.demo.reconciliation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Formatting of numbers in user-facing messages.
 */
final class Amounts {

    private Amounts() {
    }

    static String money(BigDecimal amount) {
        return "€" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Money with an explicit sign, e.g. {@code +€0.50} or {@code -€0.50}.
     */
    static String signedMoney(BigDecimal amount) {
        return (amount.signum() < 0 ? "-" : "+") + money(amount.abs());
    }

    /**
     * Money for each of the given distinct amounts. Falls back to the plain
     * value when rounding to cents would make two amounts read the same.
     */
    static List<String> distinctMoney(Collection<BigDecimal> amounts) {
        List<String> formatted = amounts.stream()
                .map(Amounts::money)
                .collect(Collectors.toList());
        if (new HashSet<>(formatted).size() == formatted.size()) {
            return formatted;
        }
        return amounts.stream()
                .map(amount -> "€" + amount.toPlainString())
                .collect(Collectors.toList());
    }

    static String quantity(BigDecimal quantity) {
        return quantity.stripTrailingZeros().toPlainString();
    }
}
