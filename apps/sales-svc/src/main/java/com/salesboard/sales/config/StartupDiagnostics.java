package com.salesboard.sales.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final SalesboardProperties props;

    public StartupDiagnostics(SalesboardProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var query = props.query();
        log.info("Startup diagnostics: limit range=[{}, {}], defaultLimit={}, migrateEnabled={}",
                query.minLimit(), query.maxLimit(), query.defaultLimit(), props.db().migrateEnabledFlag());
        log.info("CORS config: allowedOrigins={}", props.cors().allowedOrigins());
    }
}
