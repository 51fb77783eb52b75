package com.expirebot.expiry.sweep;

import com.expirebot.expiry.common.Sleeper;
import com.expirebot.expiry.config.ExpirebotProperties;
import com.expirebot.expiry.eviction.EvictionResult;
import com.expirebot.expiry.eviction.RedactionActuator;
import com.expirebot.expiry.matrix.MatrixClient;
import com.expirebot.expiry.matrix.MatrixEventNotFoundException;
import com.expirebot.expiry.tracking.TrackedEvent;
import com.expirebot.expiry.tracking.TrackedEventStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically redacts tracked messages that outlived their room's TTL.
 *
 * <p>A pass starts right after startup and then {@code expirebot.sweep.interval} after the
 * previous pass finished. The cutoff is recomputed from the current policy on every pass, so a
 * lowered TTL also applies to messages tracked before the change. A local entry is only removed
 * once the homeserver confirmed the redaction.
 */
@Component
public class ExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final TrackedEventStore trackedEventStore;
    private final MatrixClient matrixClient;
    private final RedactionActuator actuator;
    private final boolean enabled;
    private final int batchSize;
    private final Duration batchPause;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile SweepSummary lastSummary;

    @Autowired
    public ExpirySweeper(TrackedEventStore trackedEventStore,
                         MatrixClient matrixClient,
                         RedactionActuator actuator,
                         ExpirebotProperties properties) {
        this(trackedEventStore, matrixClient, actuator, properties.sweep(), Clock.systemUTC(), Sleeper.SYSTEM);
    }

    ExpirySweeper(TrackedEventStore trackedEventStore,
                  MatrixClient matrixClient,
                  RedactionActuator actuator,
                  ExpirebotProperties.Sweep settings,
                  Clock clock,
                  Sleeper sleeper) {
        this.trackedEventStore = trackedEventStore;
        this.matrixClient = matrixClient;
        this.actuator = actuator;
        this.enabled = settings.enabledFlag();
        this.batchSize = settings.batchSize();
        this.batchPause = settings.batchPause();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Scheduled(fixedDelayString = "${expirebot.sweep.interval:PT60S}", initialDelay = 0)
    public void sweepOnSchedule() {
        if (!enabled) {
            return;
        }
        MDC.put("trace_id", "sweep-" + UUID.randomUUID());
        try {
            SweepSummary summary = runSweepPass();
            if (summary.expired() > 0 || summary.errors() > 0) {
                log.info("Expiry sweep: {} tracked, {} expired, {} redacted, {} failed, {} errors",
                        summary.candidates(), summary.expired(), summary.evicted(), summary.failed(),
                        summary.errors());
            } else {
                log.debug("Expiry sweep: {} tracked, nothing expired", summary.candidates());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Expiry sweep cancelled");
        } catch (RuntimeException e) {
            log.error("Expiry sweep pass failed, next pass in the regular interval", e);
        } finally {
            MDC.remove("trace_id");
        }
    }

    /**
     * Runs one full pass over every tracked entry.
     *
     * @throws InterruptedException when cancelled; entries not yet visited are left untouched
     */
    public SweepSummary runSweepPass() throws InterruptedException {
        Instant startedAt = clock.instant();
        long nowMs = startedAt.toEpochMilli();
        List<TrackedEvent> candidates = trackedEventStore.listExpiryCandidates();
        Tally tally = new Tally();

        for (int from = 0; from < candidates.size(); from += batchSize) {
            if (from > 0) {
                sleeper.sleep(batchPause);
            }
            int to = Math.min(from + batchSize, candidates.size());
            for (TrackedEvent candidate : candidates.subList(from, to)) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Expiry sweep interrupted");
                }
                processCandidate(candidate, nowMs, tally);
            }
        }

        SweepSummary summary = new SweepSummary(startedAt, candidates.size(), tally.expired, tally.evicted,
                tally.failed, tally.errors);
        lastSummary = summary;
        return summary;
    }

    public Optional<SweepSummary> lastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    private void processCandidate(TrackedEvent candidate, long nowMs, Tally tally) throws InterruptedException {
        String eventId = candidate.eventId();
        String roomId = candidate.roomId();
        long observedTs;
        try {
            observedTs = matrixClient.getEventTimestamp(roomId, eventId);
        } catch (MatrixEventNotFoundException ex) {
            // also returned when the bot cannot see the event, so the entry stays tracked
            log.warn("Event {} in {} not visible to the bot, keeping it for the next pass", eventId, roomId);
            tally.errors++;
            return;
        } catch (RuntimeException ex) {
            log.error("Failed to look up {} in {}: {}", eventId, roomId, ex.getMessage());
            tally.errors++;
            return;
        }

        long cutoff = nowMs - candidate.ttlMs();
        if (observedTs >= cutoff) {
            return;
        }
        tally.expired++;

        if (actuator.evict(roomId, eventId) != EvictionResult.SUCCESS) {
            tally.failed++;
            return;
        }
        try {
            trackedEventStore.delete(eventId);
            tally.evicted++;
            log.info("Redacted event {} in room {}", eventId, roomId);
        } catch (RuntimeException ex) {
            // redaction is done; the next pass re-redacts and retries the delete
            log.error("Redacted {} in {} but could not remove the tracked entry", eventId, roomId, ex);
            tally.errors++;
        }
    }

    private static final class Tally {
        int expired;
        int evicted;
        int failed;
        int errors;
    }
}
