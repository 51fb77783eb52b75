package com.expirebot.expiry.appservice;

import com.expirebot.expiry.config.ExpirebotProperties;
import jakarta.validation.constraints.Size;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives event transactions pushed by the homeserver to this application service.
 */
@RestController
@Validated
public class AppserviceTransactionController {
    private static final Logger log = LoggerFactory.getLogger(AppserviceTransactionController.class);

    private final RoomEventDispatcher dispatcher;
    private final TransactionDeduplicator deduplicator;
    private final byte[] hsToken;

    public AppserviceTransactionController(RoomEventDispatcher dispatcher,
                                           TransactionDeduplicator deduplicator,
                                           ExpirebotProperties properties) {
        this.dispatcher = dispatcher;
        this.deduplicator = deduplicator;
        this.hsToken = properties.appservice().hsToken().getBytes(StandardCharsets.UTF_8);
    }

    @PutMapping({"/_matrix/app/v1/transactions/{txnId}", "/transactions/{txnId}"})
    public ResponseEntity<Map<String, Object>> pushTransaction(
            @PathVariable @Size(min = 1, max = 255) String txnId,
            @RequestBody AppserviceTransaction transaction,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(name = "access_token", required = false) String accessToken) {
        verifyToken(authorization, accessToken);
        if (deduplicator.isDuplicate(txnId)) {
            return ResponseEntity.ok(Map.of());
        }
        int failed = 0;
        for (RoomEvent event : transaction.eventsOrEmpty()) {
            try {
                dispatcher.dispatch(event);
            } catch (RuntimeException ex) {
                failed++;
                log.error("Failed to handle {} event {} in {}", event.type(), event.eventId(), event.roomId(), ex);
            }
        }
        log.debug("Transaction {}: {} events, {} failed", txnId, transaction.eventsOrEmpty().size(), failed);
        return ResponseEntity.ok(Map.of());
    }

    private void verifyToken(String authorization, String accessToken) {
        String presented = null;
        if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
            presented = authorization.substring(7).strip();
        } else if (accessToken != null) {
            presented = accessToken;
        }
        if (presented == null || presented.isEmpty()) {
            throw new AppserviceAuthenticationException("Missing homeserver token", false);
        }
        if (!MessageDigest.isEqual(hsToken, presented.getBytes(StandardCharsets.UTF_8))) {
            throw new AppserviceAuthenticationException("Invalid homeserver token", true);
        }
    }
}
