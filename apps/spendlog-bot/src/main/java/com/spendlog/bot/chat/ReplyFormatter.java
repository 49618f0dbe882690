package com.spendlog.bot.chat;

import com.spendlog.bot.config.SpendlogProperties;
import com.spendlog.bot.ledger.ExpenseLedger;
import com.spendlog.bot.model.Expense;
import com.spendlog.bot.service.SpendingReport;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

/** User-facing texts. Plain text only, no Telegram markup. */
@Component
public class ReplyFormatter {

    static final String WELCOME = """
            Привет! Я трекер расходов 💸

            Добавляй расходы сообщениями:
            Например: 200 продукты
            или: 15 кофе

            Команды:
            /stats — статистика за месяц
            /stats день — за сегодня
            /stats неделя — за неделю
            /help — справка""";

    static final String HELP = """
            Формат добавления: '<сумма> <категория>'
            Примеры:
            — 200 продукты
            — 50 транспорт

            Команды:
            /stats [день|неделя] — показать статистику
            /start — начать""";

    static final String FORMAT_REMINDER = "Формат: '<сумма> <категория>'. Например: 150 кофе";

    static final String UNKNOWN_COMMAND = "Неизвестная команда. Список команд: /help";

    private final String currencyLabel;

    public ReplyFormatter(SpendlogProperties props) {
        this.currencyLabel = props.report().currencyLabelOrDefault();
    }

    public String welcome() {
        return WELCOME;
    }

    public String help() {
        return HELP;
    }

    public String formatReminder() {
        return FORMAT_REMINDER;
    }

    public String unknownCommand() {
        return UNKNOWN_COMMAND;
    }

    public String recorded(Expense expense) {
        return "Добавлено: " + money(expense.amount()) + " — " + expense.category();
    }

    public String report(SpendingReport report) {
        String label = report.period().kind().label();
        if (report.isEmpty()) {
            return "За период «" + label + "» расходов нет.";
        }
        StringJoiner lines = new StringJoiner("\n");
        lines.add("📊 Статистика за " + label + ":");
        for (ExpenseLedger.CategoryTotal row : report.categories()) {
            lines.add("- " + row.category() + ": " + money(row.total()) + " " + currencyLabel);
        }
        lines.add("");
        lines.add("Итого: " + money(report.grandTotal()) + " " + currencyLabel);
        return lines.toString();
    }

    public String failure(String traceId) {
        return "Не удалось обработать запрос, попробуйте позже (traceId=" + traceId + ").";
    }

    private String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
