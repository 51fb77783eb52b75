package com.expirebot.expiry.eviction;

import com.expirebot.expiry.common.BackoffPolicy;
import com.expirebot.expiry.common.Sleeper;
import com.expirebot.expiry.config.ExpirebotProperties;
import com.expirebot.expiry.matrix.MatrixClient;
import com.expirebot.expiry.matrix.MatrixRateLimitedException;
import com.expirebot.expiry.matrix.MatrixRequestException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Redacts one message at a time across all rooms. Successive homeserver calls start at least
 * {@code minSpacing} apart, and rate-limited calls are retried with capped exponential backoff.
 */
@Component
public class RedactionActuator {

    private static final Logger log = LoggerFactory.getLogger(RedactionActuator.class);

    private final MatrixClient matrixClient;
    private final BackoffPolicy backoffPolicy;
    private final Duration minSpacing;
    private final String reason;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Semaphore permit = new Semaphore(1, true);
    // guarded by permit
    private Instant lastCallAt;

    @Autowired
    public RedactionActuator(MatrixClient matrixClient, ExpirebotProperties properties) {
        this(matrixClient,
                properties.eviction().backoffPolicy(),
                properties.eviction().minSpacing(),
                properties.eviction().reason(),
                Clock.systemUTC(),
                Sleeper.SYSTEM);
    }

    public RedactionActuator(MatrixClient matrixClient, BackoffPolicy backoffPolicy, Duration minSpacing,
                             String reason, Clock clock, Sleeper sleeper) {
        if (minSpacing.isNegative()) {
            throw new IllegalArgumentException("minSpacing must not be negative");
        }
        this.matrixClient = matrixClient;
        this.backoffPolicy = backoffPolicy;
        this.minSpacing = minSpacing;
        this.reason = reason;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Redacts the event, blocking until the global permit is free.
     *
     * @throws InterruptedException when cancelled while waiting for the permit, the spacing delta
     *                              or a backoff delay
     */
    public EvictionResult evict(String roomId, String eventId) throws InterruptedException {
        permit.acquire();
        try {
            return redactWithBackoff(roomId, eventId);
        } finally {
            permit.release();
        }
    }

    private EvictionResult redactWithBackoff(String roomId, String eventId) throws InterruptedException {
        int maxAttempts = backoffPolicy.getMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            awaitSpacing();
            lastCallAt = clock.instant();
            try {
                matrixClient.redact(roomId, eventId, reason);
                lastCallAt = clock.instant();
                return EvictionResult.SUCCESS;
            } catch (MatrixRateLimitedException ex) {
                long delayMs = backoffDelayMs(attempt, ex);
                log.warn("Redaction of {} in {} rate limited (attempt {}/{}), backing off {} ms",
                        eventId, roomId, attempt + 1, maxAttempts, delayMs);
                sleeper.sleep(Duration.ofMillis(delayMs));
            } catch (MatrixRequestException ex) {
                log.error("Failed to redact {} in {}: {}", eventId, roomId, ex.getMessage());
                return EvictionResult.FAILURE;
            } catch (RuntimeException ex) {
                log.error("Unexpected error redacting {} in {}", eventId, roomId, ex);
                return EvictionResult.FAILURE;
            }
        }
        log.error("Giving up on redaction of {} in {} after {} rate-limited attempts", eventId, roomId, maxAttempts);
        return EvictionResult.FAILURE;
    }

    // a larger server hint wins over our own schedule, but never past the cap
    private long backoffDelayMs(int attempt, MatrixRateLimitedException ex) {
        long delayMs = backoffPolicy.delayMs(attempt);
        if (ex.getRetryAfterMs() > delayMs) {
            delayMs = Math.min(ex.getRetryAfterMs(), backoffPolicy.getMaxDelayMs());
        }
        return delayMs;
    }

    private void awaitSpacing() throws InterruptedException {
        if (lastCallAt == null) {
            return;
        }
        Duration remaining = minSpacing.minus(Duration.between(lastCallAt, clock.instant()));
        if (!remaining.isNegative() && !remaining.isZero()) {
            sleeper.sleep(remaining);
        }
    }
}
