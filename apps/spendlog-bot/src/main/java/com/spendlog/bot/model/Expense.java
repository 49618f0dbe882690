package com.spendlog.bot.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One recorded expense. {@code id} is null until the ledger assigns it; a null
 * {@code createdAt} leaves the timestamp to the database default.
 */
public record Expense(
        Long id,
        long userId,
        BigDecimal amount,
        String category,
        Instant createdAt
) {
    public static Expense pending(long userId, BigDecimal amount, String category) {
        return new Expense(null, userId, amount, category, null);
    }

    public Expense withId(long newId) {
        return new Expense(newId, userId, amount, category, createdAt);
    }
}
