package com.expirebot.expiry.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

    @Test
    @DisplayName("default policy doubles from 1s and is capped at 32s")
    void defaultPolicyDoublesAndCaps() {
        BackoffPolicy policy = BackoffPolicy.defaultPolicy();

        assertThat(policy.delayMs(0)).isEqualTo(1_000L);
        assertThat(policy.delayMs(1)).isEqualTo(2_000L);
        assertThat(policy.delayMs(2)).isEqualTo(4_000L);
        assertThat(policy.delayMs(3)).isEqualTo(8_000L);
        assertThat(policy.delayMs(4)).isEqualTo(16_000L);
        assertThat(policy.delayMs(5)).isEqualTo(32_000L);
        assertThat(policy.delayMs(6)).isEqualTo(32_000L);
        assertThat(policy.getMaxAttempts()).isEqualTo(5);
    }

    @Test
    @DisplayName("very large attempt numbers do not overflow")
    void largeAttemptStaysAtCap() {
        BackoffPolicy policy = new BackoffPolicy(1_000L, 32_000L, 5);
        assertThat(policy.delayMs(Integer.MAX_VALUE)).isEqualTo(32_000L);
    }

    @Test
    void negativeAttemptUsesBaseDelay() {
        assertThat(BackoffPolicy.defaultPolicy().delayMs(-3)).isEqualTo(1_000L);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new BackoffPolicy(0, 10, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(10, 5, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(10, 20, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
