package com.tradepilot.config;

import com.tradepilot.oms.RetryPolicy;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the exchange submission {@link RetryPolicy} from {@code tradepilot.execution.retry.*}.
 *
 * <p>Defaults: 3 attempts, 200 ms initial backoff doubling up to 2 s. The per-attempt
 * acknowledgement timeout ({@code tradepilot.execution.ack-timeout-ms}) is read by
 * {@link com.tradepilot.oms.OrderExecutionManager} directly.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${tradepilot.execution.retry.max-attempts:3}") int maxAttempts,
            @Value("${tradepilot.execution.retry.initial-backoff-ms:200}") long initialBackoffMs,
            @Value("${tradepilot.execution.retry.multiplier:2.0}") double multiplier,
            @Value("${tradepilot.execution.retry.max-backoff-ms:2000}") long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalStateException("tradepilot.execution.retry.max-attempts must be at least 1");
        }
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(Duration.ofMillis(initialBackoffMs))
                .multiplier(multiplier)
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .build();
        log.info("Exchange retry policy: {}", policy);
        return policy;
    }
}
