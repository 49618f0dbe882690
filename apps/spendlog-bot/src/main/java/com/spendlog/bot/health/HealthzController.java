package com.spendlog.bot.health;

import com.spendlog.bot.chat.TelegramBotLauncher;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint for the hosting platform. Reports whether the Telegram polling
 * session is up; does not touch the database.
 */
@RestController
public class HealthzController {

    private final ObjectProvider<TelegramBotLauncher> launcher;

    public HealthzController(ObjectProvider<TelegramBotLauncher> launcher) {
        this.launcher = launcher;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        TelegramBotLauncher current = launcher.getIfAvailable();
        String telegram;
        if (current == null) {
            telegram = "disabled";
        } else {
            telegram = current.isRunning() ? "polling" : "stopped";
        }
        return Map.of("status", "UP", "telegram", telegram);
    }
}
