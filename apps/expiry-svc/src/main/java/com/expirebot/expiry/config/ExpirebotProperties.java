package com.expirebot.expiry.config;

import com.expirebot.expiry.common.BackoffPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "expirebot")
public record ExpirebotProperties(
        Homeserver homeserver,
        Appservice appservice,
        Sweep sweep,
        Eviction eviction,
        Policy policy,
        Command command
) {

    @ConstructorBinding
    public ExpirebotProperties {
        if (homeserver == null) {
            throw new IllegalArgumentException("homeserver configuration must be provided");
        }
        if (appservice == null) {
            throw new IllegalArgumentException("appservice configuration must be provided");
        }
        // the remaining sections are tuning knobs with production defaults
        if (sweep == null) {
            sweep = new Sweep(null, null, null, null);
        }
        if (eviction == null) {
            eviction = new Eviction(null, null, null, null, null);
        }
        if (policy == null) {
            policy = new Policy(null);
        }
        if (command == null) {
            command = new Command(null);
        }
    }

    public record Homeserver(String baseUrl, String accessToken, String botUserId, Duration requestTimeout) {
        public Homeserver {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must be provided");
            }
            if (accessToken == null || accessToken.isBlank()) {
                throw new IllegalArgumentException("accessToken must be provided");
            }
            if (botUserId == null || !botUserId.startsWith("@") || !botUserId.contains(":")) {
                throw new IllegalArgumentException("botUserId must be a full Matrix user id like @bot:example.org");
            }
            if (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            if (requestTimeout == null) {
                requestTimeout = Duration.ofSeconds(30);
            }
        }
    }

    public record Appservice(String hsToken, Integer recentTransactions) {
        public Appservice {
            if (hsToken == null || hsToken.isBlank()) {
                throw new IllegalArgumentException("hsToken must be provided");
            }
            if (recentTransactions == null) {
                recentTransactions = 1000;
            }
            if (recentTransactions <= 0) {
                throw new IllegalArgumentException("recentTransactions must be positive");
            }
        }
    }

    public record Sweep(Boolean enabled, Duration interval, Integer batchSize, Duration batchPause) {
        public Sweep {
            if (interval == null) {
                interval = Duration.ofSeconds(60);
            }
            if (batchSize == null) {
                batchSize = 10;
            }
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            if (batchPause == null) {
                batchPause = Duration.ofMillis(500);
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }
    }

    public record Eviction(Duration minSpacing, Duration initialBackoff, Duration maxBackoff, Integer maxAttempts, String reason) {
        public Eviction {
            if (minSpacing == null) {
                minSpacing = Duration.ofMillis(100);
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofSeconds(1);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofSeconds(32);
            }
            if (maxAttempts == null) {
                maxAttempts = 5;
            }
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be positive");
            }
            if (maxBackoff.compareTo(initialBackoff) < 0) {
                throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
            }
            if (reason == null || reason.isBlank()) {
                reason = "Message expired";
            }
        }

        public BackoffPolicy backoffPolicy() {
            return new BackoffPolicy(initialBackoff.toMillis(), maxBackoff.toMillis(), maxAttempts);
        }
    }

    public record Policy(Duration defaultTtl) {
        public Policy {
            if (defaultTtl == null) {
                defaultTtl = Duration.ofDays(7);
            }
            if (defaultTtl.isNegative() || defaultTtl.isZero()) {
                throw new IllegalArgumentException("defaultTtl must be positive");
            }
        }
    }

    public record Command(String prefix) {
        public Command {
            if (prefix == null || prefix.isBlank()) {
                prefix = "!expire";
            }
        }
    }
}
