package com.expirebot.expiry.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final ExpirebotProperties props;

    public StartupDiagnostics(ExpirebotProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        // Avoid logging secrets; only structural info.
        var homeserver = props.homeserver();
        log.info("Homeserver config: baseUrl='{}', botUserId='{}', accessTokenPresent={}, requestTimeout={}",
                homeserver.baseUrl(), homeserver.botUserId(),
                homeserver.accessToken() != null && !homeserver.accessToken().isBlank(),
                homeserver.requestTimeout());

        var sweep = props.sweep();
        log.info("Sweep config: enabled={}, interval={}, batchSize={}, batchPause={}",
                sweep.enabledFlag(), sweep.interval(), sweep.batchSize(), sweep.batchPause());

        var eviction = props.eviction();
        log.info("Eviction config: minSpacing={}, backoff={}..{}, maxAttempts={}, defaultTtl={}, commandPrefix='{}'",
                eviction.minSpacing(), eviction.initialBackoff(), eviction.maxBackoff(), eviction.maxAttempts(),
                props.policy().defaultTtl(), props.command().prefix());
    }
}
