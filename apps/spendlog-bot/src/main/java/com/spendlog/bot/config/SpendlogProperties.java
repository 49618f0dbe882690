package com.spendlog.bot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "spendlog")
public record SpendlogProperties(
        Telegram telegram,
        Database database,
        Report report
) {

    @ConstructorBinding
    public SpendlogProperties {
        if (telegram == null) {
            throw new IllegalArgumentException("telegram configuration must be provided (set TELEGRAM_BOT_TOKEN)");
        }
        if (database == null) {
            throw new IllegalArgumentException("database configuration must be provided (set DATABASE_URL)");
        }
        // report may be null; handled via accessor method
    }

    public record Telegram(String token, String username, Boolean enabled) {
        public Telegram {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("token must be provided (set TELEGRAM_BOT_TOKEN)");
            }
            if (username == null || username.isBlank()) {
                username = "spendlog_bot";
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }

        public String tokenTail() {
            return token.length() > 4 ? token.substring(token.length() - 4) : "";
        }
    }

    public record Database(String url, String username, String password, Integer maxPoolSize) {
        public Database {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url must be provided (set DATABASE_URL)");
            }
            if (maxPoolSize != null && maxPoolSize <= 0) {
                throw new IllegalArgumentException("maxPoolSize must be positive");
            }
        }

        public int maxPoolSizeOrDefault() {
            return maxPoolSize != null ? maxPoolSize : 5;
        }

        public boolean hasUsername() {
            return username != null && !username.isBlank();
        }

        public boolean hasPassword() {
            return password != null && !password.isBlank();
        }
    }

    public Report report() {
        return report != null ? report : new Report(null);
    }

    public record Report(String currencyLabel) {
        public String currencyLabelOrDefault() {
            return (currencyLabel != null && !currencyLabel.isBlank()) ? currencyLabel : "руб.";
        }
    }
}
