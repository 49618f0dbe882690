package com.spendlog.bot.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.spendlog.bot.config.SpendlogProperties;
import com.spendlog.bot.context.RequestContextHolder;
import com.spendlog.bot.expense.ParsedExpense;
import com.spendlog.bot.ledger.ExpenseLedger;
import com.spendlog.bot.model.Expense;
import com.spendlog.bot.period.PeriodKind;
import com.spendlog.bot.period.ReportingPeriod;
import com.spendlog.bot.service.ExpenseService;
import com.spendlog.bot.service.SpendingReport;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class BotCommandDispatcherTest {

    private static final long USER = 42L;
    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-05-16T10:00:00Z");

    @Mock
    ExpenseService expenseService;

    BotCommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        SpendlogProperties props = new SpendlogProperties(
                new SpendlogProperties.Telegram("123:abc", null, false),
                new SpendlogProperties.Database("postgres://h/db", null, null, null),
                new SpendlogProperties.Report("руб.")
        );
        dispatcher = new BotCommandDispatcher(expenseService, new ReplyFormatter(props));
        RequestContextHolder.set(RequestContextHolder.RequestContext.builder()
                .traceId("test-trace")
                .build());
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
    }

    @Test
    void startAndHelpReturnStaticTexts() {
        assertThat(dispatcher.dispatch(USER, "/start")).isEqualTo(ReplyFormatter.WELCOME);
        assertThat(dispatcher.dispatch(USER, "/help")).isEqualTo(ReplyFormatter.HELP);
        assertThat(dispatcher.dispatch(USER, "/help@spendlog_bot")).isEqualTo(ReplyFormatter.HELP);
        verifyNoInteractions(expenseService);
    }

    @Test
    void expenseTextIsRecordedAndConfirmed() {
        when(expenseService.record(anyLong(), any(ParsedExpense.class))).thenAnswer(invocation -> {
            ParsedExpense parsed = invocation.getArgument(1);
            return new Expense(1L, USER, parsed.amount(), parsed.category(), null);
        });

        String reply = dispatcher.dispatch(USER, "150,5 Кофе латте");

        assertThat(reply).isEqualTo("Добавлено: 150.50 — кофе латте");
        verify(expenseService).record(USER, new ParsedExpense(new BigDecimal("150.5"), "кофе латте"));
    }

    @Test
    void unparseableTextGetsFormatReminder() {
        assertThat(dispatcher.dispatch(USER, "кофе 150")).isEqualTo(ReplyFormatter.FORMAT_REMINDER);
        assertThat(dispatcher.dispatch(USER, "   ")).isEqualTo(ReplyFormatter.FORMAT_REMINDER);
        verifyNoInteractions(expenseService);
    }

    @Test
    void exponentAmountGetsFormatReminderNotFailureReply() {
        assertThat(dispatcher.dispatch(USER, "1E2147483647 food")).isEqualTo(ReplyFormatter.FORMAT_REMINDER);
        assertThat(dispatcher.dispatch(USER, "1e-30000000 food")).isEqualTo(ReplyFormatter.FORMAT_REMINDER);
        verifyNoInteractions(expenseService);
    }

    @Test
    void statsFormatsBreakdownAndTotal() {
        when(expenseService.report(USER, "неделя")).thenReturn(new SpendingReport(
                new ReportingPeriod(PeriodKind.WEEK, START, END),
                List.of(
                        new ExpenseLedger.CategoryTotal("food", new BigDecimal("15.00")),
                        new ExpenseLedger.CategoryTotal("transport", new BigDecimal("3.00"))),
                new BigDecimal("18.00")));

        String reply = dispatcher.dispatch(USER, "/stats@spendlog_bot   неделя");

        assertThat(reply).isEqualTo("""
                📊 Статистика за неделя:
                - food: 15.00 руб.
                - transport: 3.00 руб.

                Итого: 18.00 руб.""");
    }

    @Test
    void statsWithoutArgumentAndNoExpensesSaysSo() {
        when(expenseService.report(eq(USER), isNull())).thenReturn(new SpendingReport(
                new ReportingPeriod(PeriodKind.MONTH, START, END), List.of(), new BigDecimal("0.00")));

        assertThat(dispatcher.dispatch(USER, "/stats")).isEqualTo("За период «месяц» расходов нет.");
    }

    @Test
    void multiWordArgumentIsPassedJoined() {
        when(expenseService.report(USER, "за неделю")).thenReturn(new SpendingReport(
                new ReportingPeriod(PeriodKind.MONTH, START, END), List.of(), new BigDecimal("0.00")));

        dispatcher.dispatch(USER, "/stats  за \t неделю");

        verify(expenseService).report(USER, "за неделю");
    }

    @Test
    void unknownCommandPointsToHelp() {
        assertThat(dispatcher.dispatch(USER, "/budget 100")).isEqualTo(ReplyFormatter.UNKNOWN_COMMAND);
        verifyNoInteractions(expenseService);
    }

    @Test
    void storeFailureTurnsIntoGenericReplyWithTraceId() {
        when(expenseService.record(anyLong(), any(ParsedExpense.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        String reply = dispatcher.dispatch(USER, "200 продукты");

        assertThat(reply).startsWith("Не удалось обработать запрос").contains("traceId=test-trace");
        assertThat(reply).doesNotContain("Добавлено");
    }

    @Test
    void unexpectedFailureDuringStatsAlsoGetsReply() {
        when(expenseService.report(anyLong(), any())).thenThrow(new IllegalStateException("boom"));

        assertThat(dispatcher.dispatch(USER, "/stats день")).contains("traceId=test-trace");
    }

    @Test
    void commandNameIgnoresCaseAndMention() {
        assertThat(BotCommandDispatcher.commandName("/Stats@Spendlog_Bot")).isEqualTo("stats");
        assertThat(BotCommandDispatcher.commandName("/help")).isEqualTo("help");
    }
}
