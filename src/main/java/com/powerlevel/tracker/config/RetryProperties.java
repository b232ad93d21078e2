package com.powerlevel.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff for rate-limited or unreachable GitHub calls, bound from {@code tracker.retry}.
 *
 * <p>Delay before retry N (starting at 1) is
 * {@code min(backoffMs * multiplier^(N-1), maxBackoffMs)}.
 */
@Data
@ConfigurationProperties(prefix = "tracker.retry")
public class RetryProperties {

    /** Total attempts, including the first one. */
    private int maxAttempts = 4;

    private long backoffMs = 1000;

    private long maxBackoffMs = 16000;

    private double multiplier = 2.0;

    public long delayBeforeRetry(int retryNumber) {
        double delay = backoffMs * Math.pow(multiplier, Math.max(0, retryNumber - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }
}
