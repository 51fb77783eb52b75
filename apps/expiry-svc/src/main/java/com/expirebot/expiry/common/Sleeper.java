package com.expirebot.expiry.common;

import java.time.Duration;

/**
 * Suspends the calling thread. Interruption is how the sweep and the actuator get cancelled,
 * so implementations must let {@link InterruptedException} escape.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
