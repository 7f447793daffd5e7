package com.salesboard.sales.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "salesboard")
public record SalesboardProperties(
        Query query,
        Cors cors,
        Db db
) {

    public SalesboardProperties {
        // every section is optional in application.yml; fall back to the built-in defaults
        if (query == null) {
            query = new Query(null, null, null);
        }
        if (cors == null) {
            cors = new Cors(null);
        }
        if (db == null) {
            db = new Db(null);
        }
    }

    public record Query(Integer minLimit, Integer maxLimit, Integer defaultLimit) {
        public Query {
            if (minLimit == null) minLimit = 10;
            if (maxLimit == null) maxLimit = 200;
            if (defaultLimit == null) defaultLimit = 50;
            if (minLimit <= 0) {
                throw new IllegalArgumentException("minLimit must be positive");
            }
            if (maxLimit < minLimit) {
                throw new IllegalArgumentException("maxLimit must not be below minLimit");
            }
            if (defaultLimit < minLimit || defaultLimit > maxLimit) {
                throw new IllegalArgumentException("defaultLimit must lie within [minLimit, maxLimit]");
            }
        }

        public int clampLimit(Integer requested) {
            int value = requested == null ? defaultLimit : requested;
            return Math.max(minLimit, Math.min(value, maxLimit));
        }
    }

    public record Cors(List<String> allowedOrigins) {
        public Cors {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("*");
            }
        }
    }

    public record Db(Boolean migrateEnabled) {
        public boolean migrateEnabledFlag() {
            return migrateEnabled == null || migrateEnabled;
        }
    }
}
