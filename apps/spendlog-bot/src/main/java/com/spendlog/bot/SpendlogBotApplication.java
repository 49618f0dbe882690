package com.spendlog.bot;

import com.spendlog.bot.config.SpendlogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SpendlogProperties.class)
public class SpendlogBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpendlogBotApplication.class, args);
    }
}
