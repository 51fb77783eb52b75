package com.expirebot.expiry.matrix;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class PowerLevelsTest {

    @Test
    void redactionEventLevelTakesPrecedence() {
        PowerLevels levels = new PowerLevels(Map.of(), 0, Map.of("m.room.redaction", 75), 25);
        assertThat(levels.redactionLevel()).isEqualTo(75);
    }

    @Test
    void fallsBackToRedactLevel() {
        PowerLevels levels = new PowerLevels(Map.of(), 0, Map.of("m.room.name", 50), 25);
        assertThat(levels.redactionLevel()).isEqualTo(25);
    }

    @Test
    void defaultsToFifty() {
        assertThat(new PowerLevels(null, null, null, null).redactionLevel()).isEqualTo(50);
        assertThat(PowerLevels.empty().redactionLevel()).isEqualTo(50);
    }

    @Test
    void userLevelUsesUsersDefault() {
        PowerLevels levels = new PowerLevels(Map.of("@admin:example.org", 100), 10, Map.of(), null);
        assertThat(levels.userLevel("@admin:example.org")).isEqualTo(100);
        assertThat(levels.userLevel("@guest:example.org")).isEqualTo(10);
        assertThat(new PowerLevels(null, null, null, null).userLevel("@guest:example.org")).isZero();
    }
}
