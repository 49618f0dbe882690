package com.spendlog.bot.period;

import java.util.Locale;
import java.util.Set;

public enum PeriodKind {
    DAY("сегодня", Set.of("day", "today", "день", "сегодня")),
    WEEK("неделя", Set.of("week", "неделя")),
    MONTH("месяц", Set.of("month", "месяц"));

    private final String label;
    private final Set<String> aliases;

    PeriodKind(String label, Set<String> aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    /** Name shown to the user in report headers. */
    public String label() {
        return label;
    }

    /**
     * Maps a user keyword to a period kind; blank or unknown keywords fall back to
     * {@link #MONTH}.
     */
    public static PeriodKind fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return MONTH;
        }
        String normalized = keyword.strip().toLowerCase(Locale.ROOT);
        for (PeriodKind kind : values()) {
            if (kind.aliases.contains(normalized)) {
                return kind;
            }
        }
        return MONTH;
    }
}
