package com.spendlog.bot.expense;

import java.math.BigDecimal;

public record ParsedExpense(BigDecimal amount, String category) {

    /** Category applied when the message carries only an amount. */
    public static final String DEFAULT_CATEGORY = "прочее";
}
