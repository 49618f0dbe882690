package com.spendlog.bot.expense;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses chat lines of the form {@code <amount> [category [more words]]}, e.g.
 * {@code "200 продукты"}, {@code "15,5 кофе латте"} or a bare {@code "200"}.
 * Anything that does not start with a decimal amount is rejected as a whole.
 */
public final class ExpenseParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // plain positional notation only; no exponent, so scale stays bounded by the token length
    private static final Pattern AMOUNT = Pattern.compile("[+-]?(?:\\d+(?:[.,]\\d*)?|[.,]\\d+)");

    // NUMERIC(12,2) leaves ten digits before the point
    private static final int MAX_INTEGER_DIGITS = 10;

    private ExpenseParser() {
    }

    public static Optional<ParsedExpense> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = WHITESPACE.split(trimmed, 3);

        Optional<BigDecimal> amount = parseAmount(parts[0]);
        if (amount.isEmpty()) {
            return Optional.empty();
        }

        String category = parts.length > 1 ? parts[1] : ParsedExpense.DEFAULT_CATEGORY;
        if (parts.length == 3) {
            category = category + " " + parts[2];
        }
        return Optional.of(new ParsedExpense(amount.get(), category.toLowerCase(Locale.ROOT)));
    }

    private static Optional<BigDecimal> parseAmount(String token) {
        if (!AMOUNT.matcher(token).matches()) {
            return Optional.empty();
        }
        BigDecimal value = new BigDecimal(token.replace(',', '.'));
        if (integerDigits(value) > MAX_INTEGER_DIGITS
                || integerDigits(value.setScale(2, RoundingMode.HALF_UP)) > MAX_INTEGER_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private static int integerDigits(BigDecimal value) {
        return value.precision() - value.scale();
    }
}
