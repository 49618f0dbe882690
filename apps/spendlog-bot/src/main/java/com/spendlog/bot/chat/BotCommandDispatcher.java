package com.spendlog.bot.chat;

import com.spendlog.bot.context.RequestContextHolder;
import com.spendlog.bot.expense.ExpenseParser;
import com.spendlog.bot.expense.ParsedExpense;
import com.spendlog.bot.model.Expense;
import com.spendlog.bot.service.ExpenseService;
import com.spendlog.bot.service.SpendingReport;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Routes one inbound chat text to the matching use case and returns exactly one reply.
 * Text starting with {@code /} is a command, anything else is an expense entry.
 */
@Component
public class BotCommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(BotCommandDispatcher.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final ExpenseService expenseService;
    private final ReplyFormatter formatter;

    public BotCommandDispatcher(ExpenseService expenseService, ReplyFormatter formatter) {
        this.expenseService = expenseService;
        this.formatter = formatter;
    }

    public String dispatch(long userId, String text) {
        try {
            String trimmed = text == null ? "" : text.strip();
            if (trimmed.startsWith("/")) {
                return handleCommand(userId, trimmed);
            }
            return recordExpense(userId, trimmed);
        } catch (DataAccessException ex) {
            String traceId = currentTraceId();
            log.error("Store failure while handling message from user {} traceId {}", userId, traceId, ex);
            return formatter.failure(traceId);
        } catch (RuntimeException ex) {
            String traceId = currentTraceId();
            log.error("Unexpected failure while handling message from user {} traceId {}", userId, traceId, ex);
            return formatter.failure(traceId);
        }
    }

    private String handleCommand(long userId, String text) {
        String[] parts = WHITESPACE.split(text, 2);
        String command = commandName(parts[0]);
        String args = parts.length > 1 ? String.join(" ", WHITESPACE.split(parts[1].strip())) : null;
        return switch (command) {
            case "start" -> formatter.welcome();
            case "help" -> formatter.help();
            case "stats" -> stats(userId, args);
            default -> {
                log.debug("Unknown command '/{}' from user {}", command, userId);
                yield formatter.unknownCommand();
            }
        };
    }

    private String stats(long userId, String periodKeyword) {
        SpendingReport report = expenseService.report(userId, periodKeyword);
        return formatter.report(report);
    }

    private String recordExpense(long userId, String text) {
        Optional<ParsedExpense> parsed = ExpenseParser.parse(text);
        if (parsed.isEmpty()) {
            return formatter.formatReminder();
        }
        Expense saved = expenseService.record(userId, parsed.get());
        return formatter.recorded(saved);
    }

    /** {@code "/Stats@spendlog_bot"} becomes {@code "stats"}. */
    static String commandName(String token) {
        String name = token.substring(1);
        int mention = name.indexOf('@');
        if (mention >= 0) {
            name = name.substring(0, mention);
        }
        return name.toLowerCase(Locale.ROOT);
    }

    private String currentTraceId() {
        return RequestContextHolder.get()
                .map(RequestContextHolder.RequestContext::traceId)
                .orElseGet(() -> UUID.randomUUID().toString());
    }
}
