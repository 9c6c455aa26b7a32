package com.toolflow.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry behavior for a scheduled unit.
 * Immutable and reusable across units.
 *
 * Invariants:
 * - maxAttempts >= 1 (first attempt plus retries)
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryableErrors,
    Set<String> nonRetryableErrors
) {
    /**
     * Error codes that another attempt cannot fix.
     */
    public static final Set<String> PERMANENT_ERRORS = Set.of(
        "VALIDATION_REJECTED", "UNKNOWN_TOOL", "CANCELLED", "DEPENDENCY_FAILED", "TIMEOUT");

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        retryableErrors = retryableErrors != null ? Set.copyOf(retryableErrors) : Set.of();
        nonRetryableErrors = nonRetryableErrors != null ? Set.copyOf(nonRetryableErrors) : Set.of();
    }

    /**
     * Single attempt, no retry.
     */
    public static RetryPolicy noRetry() {
        return withRetries(0, Duration.ZERO);
    }

    /**
     * Exponential backoff without jitter: the delay before retry k is base * 2^(k-1).
     *
     * @param retries additional attempts after the first failure
     * @param baseBackoff delay before the first retry
     */
    public static RetryPolicy withRetries(int retries, Duration baseBackoff) {
        return builder()
            .maxAttempts(retries + 1)
            .initialBackoff(baseBackoff)
            .build();
    }

    /**
     * Copy of this policy allowing the given number of retries.
     */
    public RetryPolicy retries(int retries) {
        return new RetryPolicy(retries + 1, initialBackoff, maxBackoff, backoffMultiplier,
            jitterFactor, retryableErrors, nonRetryableErrors);
    }

    public int retries() {
        return maxAttempts - 1;
    }

    /**
     * Compute the delay after a failed attempt.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @return Duration to wait before the next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        double baseBackoffMs = initialBackoff.toMillis() *
            Math.pow(backoffMultiplier, attemptNumber - 1);
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        if (jitterFactor == 0.0) {
            return Duration.ofMillis((long) cappedBackoffMs);
        }
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if the given error code should trigger a retry.
     */
    public boolean shouldRetry(String errorCode) {
        if (nonRetryableErrors.contains(errorCode)) {
            return false;
        }
        if (retryableErrors.isEmpty()) {
            return true;
        }
        return retryableErrors.contains(errorCode);
    }

    /**
     * @param currentAttempt current attempt number (1-indexed)
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 1;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.0;
        private Set<String> retryableErrors = Set.of();
        private Set<String> nonRetryableErrors = PERMANENT_ERRORS;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryableErrors(Set<String> retryableErrors) {
            this.retryableErrors = retryableErrors;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            Duration cap = maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
            return new RetryPolicy(
                maxAttempts, initialBackoff, cap,
                backoffMultiplier, jitterFactor,
                retryableErrors, nonRetryableErrors
            );
        }
    }
}
