package com.toolflow.engine.config;

import com.toolflow.core.model.RetryPolicy;
import com.toolflow.oracle.OracleFailurePolicy;
import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.Locale;

/**
 * Engine settings read from {@code toolflow.*} keys.
 *
 * <pre>
 * toolflow.concurrency=3
 * toolflow.retry.base-backoff-ms=200
 * toolflow.retry.max-backoff-ms=30000
 * toolflow.retry.default-retries=0
 * toolflow.dependency-timeout-ms=300000
 * toolflow.oracle.failure-policy=fail-open
 * toolflow.storage=memory            # or jdbc
 * toolflow.jdbc.url=jdbc:sqlite:toolflow.db
 * </pre>
 */
public record ToolflowProperties(
    int concurrency,
    Duration baseBackoff,
    Duration maxBackoff,
    int defaultRetries,
    Duration dependencyTimeout,
    OracleFailurePolicy oracleFailurePolicy,
    Storage storage,
    String jdbcUrl
) {
    public static final String PREFIX = "toolflow.";

    public enum Storage {
        MEMORY,
        JDBC;

        static Storage parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public ToolflowProperties {
        if (concurrency < 1) {
            throw new IllegalArgumentException(PREFIX + "concurrency must be >= 1");
        }
        if (defaultRetries < 0) {
            throw new IllegalArgumentException(PREFIX + "retry.default-retries must be >= 0");
        }
        if (storage == Storage.JDBC && (jdbcUrl == null || jdbcUrl.isBlank())) {
            throw new IllegalArgumentException(PREFIX + "jdbc.url is required when storage=jdbc");
        }
    }

    public static ToolflowProperties defaults() {
        return new ToolflowProperties(3, Duration.ofMillis(200), Duration.ofSeconds(30), 0,
            Duration.ofMinutes(5), OracleFailurePolicy.FAIL_OPEN, Storage.MEMORY, "jdbc:sqlite:toolflow.db");
    }

    public static ToolflowProperties from(Environment env) {
        ToolflowProperties d = defaults();
        return new ToolflowProperties(
            env.getProperty(PREFIX + "concurrency", Integer.class, d.concurrency()),
            Duration.ofMillis(env.getProperty(PREFIX + "retry.base-backoff-ms", Long.class, d.baseBackoff().toMillis())),
            Duration.ofMillis(env.getProperty(PREFIX + "retry.max-backoff-ms", Long.class, d.maxBackoff().toMillis())),
            env.getProperty(PREFIX + "retry.default-retries", Integer.class, d.defaultRetries()),
            Duration.ofMillis(env.getProperty(PREFIX + "dependency-timeout-ms", Long.class, d.dependencyTimeout().toMillis())),
            OracleFailurePolicy.parse(env.getProperty(PREFIX + "oracle.failure-policy")),
            Storage.parse(env.getProperty(PREFIX + "storage", "memory")),
            env.getProperty(PREFIX + "jdbc.url", d.jdbcUrl())
        );
    }

    /**
     * Default retry policy for scheduled units.
     */
    public RetryPolicy retryPolicy() {
        return RetryPolicy.builder()
            .maxAttempts(defaultRetries + 1)
            .initialBackoff(baseBackoff)
            .maxBackoff(maxBackoff)
            .build();
    }
}
