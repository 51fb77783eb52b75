package com.expirebot.expiry.eviction;

public enum EvictionResult {
    /** The homeserver accepted the redaction. */
    SUCCESS,
    /** Gave up: retries exhausted or a non-transient error. The entry stays for the next pass. */
    FAILURE
}
