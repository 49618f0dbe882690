package com.spendlog.bot.ledger;

import com.spendlog.bot.model.Expense;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public interface ExpenseLedger {
    record CategoryTotal(String category, BigDecimal total) {}

    /** Per-category totals, largest first, plus the sum over all of them. */
    record Summary(List<CategoryTotal> categories, BigDecimal grandTotal) {
        public boolean isEmpty() {
            return categories.isEmpty();
        }
    }

    Expense save(Expense expense);

    Summary summarize(long userId, Instant fromInclusive, Instant toInclusive);
}
