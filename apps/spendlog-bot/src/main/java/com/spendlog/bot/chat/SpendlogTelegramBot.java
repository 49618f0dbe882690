package com.spendlog.bot.chat;

import com.spendlog.bot.config.SpendlogProperties;
import com.spendlog.bot.context.RequestContextHolder;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Long-polling adapter: unwraps text messages, hands them to the dispatcher and sends the
 * reply back to the originating chat. Updates without text are ignored.
 */
public class SpendlogTelegramBot extends TelegramLongPollingBot {
    private static final Logger log = LoggerFactory.getLogger(SpendlogTelegramBot.class);

    private final String username;
    private final BotCommandDispatcher dispatcher;

    public SpendlogTelegramBot(SpendlogProperties.Telegram telegram, BotCommandDispatcher dispatcher) {
        super(telegram.token());
        this.username = telegram.username();
        this.dispatcher = dispatcher;
    }

    @Override
    public String getBotUsername() {
        return username;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (!update.hasMessage()) {
            return;
        }
        Message message = update.getMessage();
        if (!message.hasText() || message.getFrom() == null) {
            return;
        }
        long userId = message.getFrom().getId();
        String traceId = UUID.randomUUID().toString();
        RequestContextHolder.set(RequestContextHolder.RequestContext.builder()
                .traceId(traceId)
                .build());
        MDC.put("trace_id", traceId);
        MDC.put("user_id", String.valueOf(userId));
        try {
            String reply = dispatcher.dispatch(userId, message.getText());
            sendReply(message.getChatId(), reply);
        } finally {
            MDC.remove("user_id");
            MDC.remove("trace_id");
            RequestContextHolder.clear();
        }
    }

    void sendReply(Long chatId, String text) {
        SendMessage reply = SendMessage.builder()
                .chatId(String.valueOf(chatId))
                .text(text)
                .build();
        try {
            execute(reply);
        } catch (TelegramApiException ex) {
            log.error("Failed to send reply to chat {}", chatId, ex);
        }
    }
}
