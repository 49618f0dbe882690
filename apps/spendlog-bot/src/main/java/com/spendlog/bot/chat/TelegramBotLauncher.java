package com.spendlog.bot.chat;

import com.spendlog.bot.config.SpendlogProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

/**
 * Starts the long-polling session once the context is ready and stops it on shutdown.
 * Disabled with {@code spendlog.telegram.enabled=false} (tests, local runs without a bot).
 */
@Component
@ConditionalOnProperty(prefix = "spendlog.telegram", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TelegramBotLauncher {
    private static final Logger log = LoggerFactory.getLogger(TelegramBotLauncher.class);

    private final SpendlogProperties props;
    private final BotCommandDispatcher dispatcher;

    private SpendlogTelegramBot bot;
    private BotSession session;

    public TelegramBotLauncher(SpendlogProperties props, BotCommandDispatcher dispatcher) {
        this.props = props;
        this.dispatcher = dispatcher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        bot = new SpendlogTelegramBot(props.telegram(), dispatcher);
        try {
            TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
            session = api.registerBot(bot);
        } catch (TelegramApiException ex) {
            throw new IllegalStateException("Telegram bot registration failed: " + ex.getMessage(), ex);
        }
        log.info("Telegram bot @{} started (long polling)", bot.getBotUsername());
    }

    public boolean isRunning() {
        return session != null && session.isRunning();
    }

    @PreDestroy
    void stop() {
        if (session != null && session.isRunning()) {
            session.stop();
            log.info("Telegram polling session stopped");
        }
        if (bot != null) {
            bot.onClosing();
        }
    }
}
