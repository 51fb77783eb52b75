package com.expirebot.expiry.appservice;

import com.expirebot.expiry.config.ExpirebotProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Remembers the most recent transaction ids so a transaction the homeserver re-sends after a
 * timeout is acknowledged without being processed twice.
 */
@Component
public class TransactionDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(TransactionDeduplicator.class);

    private final Map<String, Boolean> seen;

    @Autowired
    public TransactionDeduplicator(ExpirebotProperties properties) {
        this(properties.appservice().recentTransactions());
    }

    TransactionDeduplicator(int capacity) {
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Records the transaction id.
     *
     * @return true if the id was already seen
     */
    public synchronized boolean isDuplicate(String txnId) {
        boolean duplicate = seen.putIfAbsent(txnId, Boolean.TRUE) != null;
        if (duplicate) {
            log.debug("Transaction {} already processed", txnId);
        }
        return duplicate;
    }

    public synchronized int size() {
        return seen.size();
    }
}
