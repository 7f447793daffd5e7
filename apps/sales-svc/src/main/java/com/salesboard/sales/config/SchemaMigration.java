package com.salesboard.sales.config;

import jakarta.annotation.PostConstruct;
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
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Applies {@code db/migration/schema.sql} once at startup. Every statement in that script is
 * {@code IF NOT EXISTS}, so running against an already provisioned database changes nothing.
 * Disable with {@code salesboard.db.migrate-enabled=false} when the schema is managed elsewhere.
 */
@Component
public class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);
    static final String SCRIPT_LOCATION = "db/migration/schema.sql";

    private final DataSource dataSource;
    private final SalesboardProperties properties;

    public SchemaMigration(DataSource dataSource, SalesboardProperties properties) {
        this.dataSource = dataSource;
        this.properties = properties;
    }

    @PostConstruct
    void migrate() {
        if (!properties.db().migrateEnabledFlag()) {
            log.info("Schema migration disabled (salesboard.db.migrate-enabled=false)");
            return;
        }
        try {
            int applied = apply(splitStatements(loadScript()));
            log.info("Schema migration completed: {} statements applied", applied);
        } catch (SQLException | IOException ex) {
            throw new IllegalStateException("Schema migration failed: " + ex.getMessage(), ex);
        }
    }

    private int apply(List<String> statements) throws SQLException {
        int applied = 0;
        try (Connection conn = dataSource.getConnection()) {
            for (String stmt : statements) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                } catch (SQLException ex) {
                    log.error("Failed executing migration statement: {}", stmt, ex);
                    throw ex;
                }
            }
        }
        return applied;
    }

    private String loadScript() throws IOException {
        ClassPathResource res = new ClassPathResource(SCRIPT_LOCATION);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    static List<String> splitStatements(String sql) {
        // plain DDL only, no procedural blocks
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(stmt -> !stmt.isEmpty())
                .toList();
    }
}
