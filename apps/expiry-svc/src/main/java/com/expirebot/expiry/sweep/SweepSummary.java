package com.expirebot.expiry.sweep;

import java.time.Instant;

/**
 * Counters for one sweep pass.
 *
 * @param candidates tracked entries joined with a policy
 * @param expired    entries older than their room's TTL
 * @param evicted    expired entries redacted and removed locally
 * @param failed     expired entries whose redaction failed and stay tracked
 * @param errors     entries skipped because of a lookup or storage error, kept for the next pass
 */
public record SweepSummary(
        Instant startedAt,
        int candidates,
        int expired,
        int evicted,
        int failed,
        int errors
) {
}
