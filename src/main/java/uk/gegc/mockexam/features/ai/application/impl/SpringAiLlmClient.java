package uk.gegc.mockexam.features.ai.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.stereotype.Service;
import uk.gegc.mockexam.features.ai.application.LlmClient;
import uk.gegc.mockexam.shared.config.AiRateLimitConfig;
import uk.gegc.mockexam.shared.exception.LlmServiceException;
import uk.gegc.mockexam.shared.exception.LlmTimeoutException;
import uk.gegc.mockexam.shared.exception.RateLimitExceededException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class SpringAiLlmClient implements LlmClient {

    private static final String METRIC_CALLS = "exam.llm.calls";

    private final ChatClient chatClient;
    private final AiRateLimitConfig rateLimitConfig;
    private final Counter successCounter;
    private final Counter rateLimitedCounter;
    private final Counter timeoutCounter;
    private final Counter errorCounter;

    public SpringAiLlmClient(ChatClient chatClient, AiRateLimitConfig rateLimitConfig, MeterRegistry meterRegistry) {
        this.chatClient = chatClient;
        this.rateLimitConfig = rateLimitConfig;
        this.successCounter = callCounter(meterRegistry, "success");
        this.rateLimitedCounter = callCounter(meterRegistry, "rate_limited");
        this.timeoutCounter = callCounter(meterRegistry, "timeout");
        this.errorCounter = callCounter(meterRegistry, "error");
    }

    @Override
    public String call(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new LlmServiceException("Prompt cannot be null or empty");
        }

        Instant start = Instant.now();
        int maxRetries = Math.max(1, rateLimitConfig.getMaxRetries());
        int retryCount = 0;

        while (true) {
            try {
                ChatResponse response = chatClient.prompt()
                        .user(prompt)
                        .call()
                        .chatResponse();

                if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                    throw new LlmServiceException("No response received from LLM service");
                }
                String text = response.getResult().getOutput().getText();
                if (text == null || text.isBlank()) {
                    throw new LlmServiceException("Empty response received from LLM service");
                }

                log.info("LLM response received - {} chars, latency {}ms, attempts {}",
                        text.length(), Duration.between(start, Instant.now()).toMillis(), retryCount + 1);
                successCounter.increment();
                return text;

            } catch (Exception e) {
                boolean lastAttempt = retryCount >= maxRetries - 1;

                if (isRateLimitError(e)) {
                    rateLimitedCounter.increment();
                    long delayMs = calculateBackoffDelay(retryCount);
                    if (lastAttempt) {
                        log.error("Rate limit still exceeded after {} attempts", maxRetries);
                        throw new RateLimitExceededException(
                                "Rate limit exceeded after " + maxRetries + " attempts. Please try again later.",
                                Math.max(1, delayMs / 1000), e);
                    }
                    log.warn("Rate limit hit (attempt {}). Waiting {} ms before retry.", retryCount + 1, delayMs);
                    sleepForRateLimit(delayMs);
                    retryCount++;
                    continue;
                }

                if (isTimeoutError(e)) {
                    timeoutCounter.increment();
                    if (lastAttempt) {
                        log.error("LLM call timed out after {} attempts", maxRetries);
                        throw new LlmTimeoutException("LLM request timed out after " + maxRetries + " attempts", e);
                    }
                    log.warn("LLM call timed out (attempt {}), retrying", retryCount + 1);
                    retryCount++;
                    continue;
                }

                errorCounter.increment();
                log.error("Error calling LLM service (attempt {})", retryCount + 1, e);
                if (lastAttempt) {
                    throw new LlmServiceException(
                            "Failed to get LLM response after " + maxRetries + " attempts: " + e.getMessage(), e);
                }
                retryCount++;
            }
        }
    }

    /**
     * Check if the exception is a rate limit error (429)
     */
    boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("429") ||
                message.toLowerCase().contains("rate limit") ||
                message.contains("rate_limit_exceeded") ||
                message.contains("Too Many Requests") ||
                message.contains("RESOURCE_EXHAUSTED");
    }

    boolean isTimeoutError(Exception e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof TimeoutException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && (message.contains("timed out") || message.contains("Timeout"))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Exponential backoff with jitter, capped at the configured maximum
     */
    long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = rateLimitConfig.getBaseDelayMs() * (long) Math.pow(2, retryCount);

        double jitterRange = rateLimitConfig.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);

        long delayWithJitter = (long) (exponentialDelay * jitter);
        return Math.min(delayWithJitter, rateLimitConfig.getMaxDelayMs());
    }

    /**
     * Sleep for the specified delay during rate limiting
     * This method can be overridden in tests to avoid actual sleeping
     */
    protected void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmServiceException("Interrupted while waiting for rate limit", ie);
        }
    }

    private static Counter callCounter(MeterRegistry registry, String outcome) {
        return Counter.builder(METRIC_CALLS)
                .description("LLM call attempts by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }
}
