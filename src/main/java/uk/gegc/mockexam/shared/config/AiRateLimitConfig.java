package uk.gegc.mockexam.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry budget of {@code SpringAiLlmClient}, spent once per subject of an exam.
 *
 * <p>Every subject generation makes a single LLM call; that call may be attempted up to
 * {@link #maxRetries} times. Rate-limited attempts wait {@code baseDelayMs * 2^attempt},
 * jittered and capped at {@link #maxDelayMs}; timed-out attempts are repeated without waiting.
 * When a parallel exam run exhausts the budget for one subject, only that subject fails.
 */
@Component
@ConfigurationProperties(prefix = "ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Attempts per subject before giving up with a rate-limit or timeout error
     */
    private int maxRetries = 10;

    /**
     * First backoff step after a rate-limited attempt, in milliseconds
     */
    private long baseDelayMs = 1000;

    /**
     * Upper bound on a single backoff wait, in milliseconds; also caps the retry-after hint
     */
    private long maxDelayMs = 60000;

    /**
     * Relative spread applied to each backoff wait (0.25 means up to 25% either way)
     */
    private double jitterFactor = 0.25;
}
