package com.spendlog.bot.service;

import com.spendlog.bot.ledger.ExpenseLedger;
import com.spendlog.bot.period.ReportingPeriod;
import java.math.BigDecimal;
import java.util.List;

public record SpendingReport(
        ReportingPeriod period,
        List<ExpenseLedger.CategoryTotal> categories,
        BigDecimal grandTotal
) {
    public boolean isEmpty() {
        return categories.isEmpty();
    }
}
