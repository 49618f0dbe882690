package com.spendlog.bot.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies {@code db/schema.sql} on startup. Every statement is "create if absent", so
 * running it against an initialized database changes nothing. Failure aborts startup.
 */
@Component
public class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final DataSource dataSource;

    public SchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void initialize() {
        List<String> statements = splitStatements(loadSchemaSql());
        try (Connection conn = dataSource.getConnection()) {
            for (String stmt : statements) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                }
            }
        } catch (SQLException ex) {
            throw new IllegalStateException("Schema initialization failed: " + ex.getMessage(), ex);
        }
        log.info("Database schema ready ({} statements applied)", statements.size());
    }

    private String loadSchemaSql() {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read " + SCHEMA_RESOURCE, ex);
        }
    }

    private List<String> splitStatements(String sql) {
        // schema.sql holds plain DDL, no procedural blocks
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(stmt -> !stmt.isEmpty())
                .toList();
    }
}
