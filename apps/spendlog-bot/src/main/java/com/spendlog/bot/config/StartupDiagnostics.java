package com.spendlog.bot.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final SpendlogProperties props;

    public StartupDiagnostics(SpendlogProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        // Structure only, never the secrets themselves.
        var telegram = props.telegram();
        log.info("Telegram config: enabled={}, username='{}', token='***{}'",
                telegram.enabledFlag(), telegram.username(), telegram.tokenTail());

        var db = props.database();
        log.info("Database config: explicitUser={}, explicitPassword={}, maxPoolSize={}",
                db.hasUsername(), db.hasPassword(), db.maxPoolSizeOrDefault());

        log.info("Report config: currencyLabel='{}'", props.report().currencyLabelOrDefault());
    }
}
