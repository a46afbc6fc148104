package com.alertbridge.orchestrator.workflow;

import java.time.Duration;

/**
 * Capped exponential backoff between ticket-creation attempts.
 *
 *   delay(n) = min(base * 2^(n-1), cap)    for n = retry_count >= 1
 *
 * With base = 2s and cap = 16s: 2s, 4s, 8s, 16s, 16s, ...
 */
public record BackoffPolicy(Duration base, Duration cap) {

    public BackoffPolicy {
        if (base == null || cap == null) {
            throw new IllegalArgumentException("base and cap are required");
        }
        if (base.isNegative() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Expected 0 <= base <= cap, got base=%s cap=%s".formatted(base, cap));
        }
    }

    public Duration delayFor(int retryCount) {
        if (retryCount < 1) {
            throw new IllegalArgumentException("retryCount must be >= 1, got " + retryCount);
        }
        int exponent = Math.min(retryCount - 1, 30);
        long millis;
        try {
            millis = Math.multiplyExact(base.toMillis(), 1L << exponent);
        } catch (ArithmeticException overflow) {
            return cap;
        }
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
