package com.tradepilot.oms;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Retry settings for exchange submission. Backoff before attempt n (n &ge; 2) is
 * {@code initialBackoff * multiplier^(n-2)}, capped at {@link #maxBackoff}.
 */
@Getter
@ToString
@Builder
public class RetryPolicy {

    /** Total attempts including the first. */
    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration initialBackoff = Duration.ofMillis(200);

    @Builder.Default
    private final double multiplier = 2.0;

    @Builder.Default
    private final Duration maxBackoff = Duration.ofSeconds(2);

    /** Blocking time spent in backoff if every attempt fails. */
    public Duration totalBackoff() {
        Duration total = Duration.ZERO;
        double next = initialBackoff.toMillis();
        for (int attempt = 2; attempt <= maxAttempts; attempt++) {
            total = total.plusMillis((long) Math.min(next, maxBackoff.toMillis()));
            next *= multiplier;
        }
        return total;
    }
}
