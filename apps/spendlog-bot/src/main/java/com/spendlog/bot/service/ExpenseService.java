package com.spendlog.bot.service;

import com.spendlog.bot.expense.ParsedExpense;
import com.spendlog.bot.ledger.ExpenseLedger;
import com.spendlog.bot.model.Expense;
import com.spendlog.bot.period.PeriodResolver;
import com.spendlog.bot.period.ReportingPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Record and report use cases. Store errors are not handled here; they reach the chat
 * boundary unchanged.
 */
@Service
public class ExpenseService {
    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    private final ExpenseLedger ledger;
    private final PeriodResolver periodResolver;

    public ExpenseService(ExpenseLedger ledger, PeriodResolver periodResolver) {
        this.ledger = ledger;
        this.periodResolver = periodResolver;
    }

    public Expense record(long userId, ParsedExpense parsed) {
        Expense saved = ledger.save(Expense.pending(userId, parsed.amount(), parsed.category()));
        log.debug("Recorded expense id={} user={} amount={} category='{}'",
                saved.id(), userId, parsed.amount(), parsed.category());
        return saved;
    }

    public SpendingReport report(long userId, String periodKeyword) {
        ReportingPeriod period = periodResolver.resolve(periodKeyword);
        ExpenseLedger.Summary summary = ledger.summarize(userId, period.start(), period.end());
        return new SpendingReport(period, summary.categories(), summary.grandTotal());
    }
}
