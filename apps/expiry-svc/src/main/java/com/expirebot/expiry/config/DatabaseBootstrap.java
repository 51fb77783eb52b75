package com.expirebot.expiry.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies {@code db/schema.sql} at startup. Every statement in the script is idempotent, so it
 * runs on each boot. Without the two tables the bot cannot do anything useful, hence startup
 * fails when a statement fails. Disable with {@code expirebot.db.bootstrap-enabled=false} when
 * the schema is managed elsewhere.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             @Value("${expirebot.db.bootstrap-enabled:true}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void applySchema() {
        if (!enabled) {
            log.info("DB bootstrap disabled (expirebot.db.bootstrap-enabled=false)");
            return;
        }
        List<String> statements = splitStatements(loadSchemaSql());
        try (Connection conn = dataSource.getConnection()) {
            for (String stmt : statements) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                } catch (SQLException ex) {
                    log.error("Failed executing schema statement: {}", stmt, ex);
                    throw ex;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", statements.size());
        } catch (SQLException e) {
            throw new IllegalStateException("Could not initialize the expirebot schema", e);
        }
    }

    private String loadSchemaSql() {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.strip().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException("Missing classpath resource " + SCHEMA_RESOURCE, e);
        }
    }

    static List<String> splitStatements(String sql) {
        // schema.sql contains no procedural blocks
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
