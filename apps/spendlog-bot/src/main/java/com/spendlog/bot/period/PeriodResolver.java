package com.spendlog.bot.period;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Turns a period keyword into a UTC window ending at the current instant. The clock is
 * read once per call so start and end agree.
 */
@Component
public class PeriodResolver {

    private final Clock clock;

    public PeriodResolver(Clock clock) {
        this.clock = clock;
    }

    public ReportingPeriod resolve(String keyword) {
        PeriodKind kind = PeriodKind.fromKeyword(keyword);
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);
        ZonedDateTime startOfDay = now.truncatedTo(ChronoUnit.DAYS);
        ZonedDateTime start = switch (kind) {
            case DAY -> startOfDay;
            // Monday = 0
            case WEEK -> startOfDay.minusDays(now.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue());
            case MONTH -> startOfDay.withDayOfMonth(1);
        };
        return new ReportingPeriod(kind, start.toInstant(), now.toInstant());
    }
}
