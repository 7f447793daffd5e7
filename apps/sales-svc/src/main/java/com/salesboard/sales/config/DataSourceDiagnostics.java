package com.salesboard.sales.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Checks the sales store connection settings before the first query. The store must be
 * PostgreSQL, and schema migration cannot run over a connection opened read-only.
 */
@Component
@Profile("!test")
public class DataSourceDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(DataSourceDiagnostics.class);

    private static final Pattern PASSWORD_PARAM = Pattern.compile("(?i)([?&]password=)[^&]*");
    private static final Pattern READ_ONLY_PARAM = Pattern.compile("(?i)[?&]readOnly=true(&|$)");

    private final DataSourceProperties dataSourceProperties;
    private final SalesboardProperties properties;

    public DataSourceDiagnostics(DataSourceProperties dataSourceProperties, SalesboardProperties properties) {
        this.dataSourceProperties = dataSourceProperties;
        this.properties = properties;
    }

    @PostConstruct
    void validate() {
        String url = dataSourceProperties.getUrl();
        boolean migrate = properties.db().migrateEnabledFlag();
        log.info("Sales store: url='{}' migration={}", redact(url), migrate ? "on" : "off");
        List<String> problems = problems(url, migrate);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Sales store misconfigured: " + String.join("; ", problems));
        }
    }

    static List<String> problems(String url, boolean migrateEnabled) {
        List<String> problems = new ArrayList<>();
        if (url == null || url.isBlank()) {
            problems.add("SPRING_DATASOURCE_URL is not set");
            return problems;
        }
        if (!url.startsWith("jdbc:postgresql:")) {
            problems.add("sales_transactions lives in PostgreSQL, got '" + redact(url) + "'");
        }
        if (migrateEnabled && READ_ONLY_PARAM.matcher(url).find()) {
            problems.add("schema migration needs a writable connection; set SALESBOARD_DB_MIGRATE=false for a read-only URL");
        }
        return problems;
    }

    static String redact(String url) {
        if (url == null) {
            return null;
        }
        return PASSWORD_PARAM.matcher(url).replaceAll("$1***");
    }
}
