package com.spendlog.bot.period;

import java.time.Instant;

/** Reporting window; both ends inclusive. */
public record ReportingPeriod(PeriodKind kind, Instant start, Instant end) {
}
