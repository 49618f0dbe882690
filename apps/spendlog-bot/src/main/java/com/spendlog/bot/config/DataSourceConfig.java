package com.spendlog.bot.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the pooled data source from {@code spendlog.database.*}. Explicit credentials win
 * over the ones embedded in the connection string.
 */
@Configuration
public class DataSourceConfig {
    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(SpendlogProperties props) {
        SpendlogProperties.Database db = props.database();
        DatabaseUrl url = DatabaseUrl.parse(db.url());

        HikariConfig config = new HikariConfig();
        config.setPoolName("spendlog-db");
        config.setJdbcUrl(url.jdbcUrl());
        String username = db.hasUsername() ? db.username() : url.username();
        String password = db.hasPassword() ? db.password() : url.password();
        if (username != null) {
            config.setUsername(username);
        }
        if (password != null) {
            config.setPassword(password);
        }
        config.setMaximumPoolSize(db.maxPoolSizeOrDefault());
        config.setAutoCommit(true);

        log.info("DataSource: url='{}' user='{}' maxPoolSize={}",
                url.redactedJdbcUrl(), username == null ? "<none>" : username, db.maxPoolSizeOrDefault());
        return new HikariDataSource(config);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
