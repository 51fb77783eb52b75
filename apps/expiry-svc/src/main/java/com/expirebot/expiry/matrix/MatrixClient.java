package com.expirebot.expiry.matrix;

import com.expirebot.expiry.config.ExpirebotProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Blocking client for the parts of the Matrix client-server API the bot needs: power levels,
 * event timestamps, redactions, notices and joins.
 */
@Component
public class MatrixClient {
    private static final Logger log = LoggerFactory.getLogger(MatrixClient.class);

    private static final String CLIENT_API = "/_matrix/client/v3";

    private final WebClient webClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong transactionCounter = new AtomicLong();
    private final long transactionEpoch = System.currentTimeMillis();

    public MatrixClient(ExpirebotProperties properties) {
        var homeserver = properties.homeserver();
        this.requestTimeout = homeserver.requestTimeout();
        this.webClient = WebClient.builder()
                .baseUrl(homeserver.baseUrl() + CLIENT_API)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + homeserver.accessToken())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Power levels of the room; a room without the state event gets the protocol defaults.
     */
    public PowerLevels getPowerLevels(String roomId) {
        try {
            PowerLevels levels = execute("get power levels of " + roomId, webClient.get()
                    .uri("/rooms/{roomId}/state/m.room.power_levels", roomId)
                    .retrieve()
                    .bodyToMono(PowerLevels.class));
            return levels != null ? levels : PowerLevels.empty();
        } catch (MatrixEventNotFoundException ex) {
            return PowerLevels.empty();
        }
    }

    /**
     * Server timestamp of an event in milliseconds since the epoch.
     *
     * @throws MatrixEventNotFoundException when the homeserver no longer knows the event
     */
    public long getEventTimestamp(String roomId, String eventId) {
        EventResponse event = execute("get event " + eventId, webClient.get()
                .uri("/rooms/{roomId}/event/{eventId}", roomId, eventId)
                .retrieve()
                .bodyToMono(EventResponse.class));
        if (event == null || event.originServerTs() == null) {
            throw new MatrixRequestException("Event " + eventId + " has no origin_server_ts", 200, null);
        }
        return event.originServerTs();
    }

    /**
     * Redacts an event.
     *
     * @throws MatrixRateLimitedException when the homeserver asks us to slow down
     * @throws MatrixRequestException on any other failure
     */
    public String redact(String roomId, String eventId, String reason) {
        EventIdResponse response = execute("redact " + eventId, webClient.put()
                .uri("/rooms/{roomId}/redact/{eventId}/{txnId}", roomId, eventId, nextTransactionId())
                .bodyValue(Map.of("reason", reason))
                .retrieve()
                .bodyToMono(EventIdResponse.class));
        return response != null ? response.eventId() : null;
    }

    public String sendNotice(String roomId, String text) {
        EventIdResponse response = execute("send notice to " + roomId, webClient.put()
                .uri("/rooms/{roomId}/send/m.room.message/{txnId}", roomId, nextTransactionId())
                .bodyValue(Map.of("msgtype", "m.notice", "body", text))
                .retrieve()
                .bodyToMono(EventIdResponse.class));
        return response != null ? response.eventId() : null;
    }

    public void joinRoom(String roomId) {
        execute("join " + roomId, webClient.post()
                .uri("/join/{roomId}", roomId)
                .bodyValue(Map.of())
                .retrieve()
                .bodyToMono(JoinResponse.class));
    }

    private <T> T execute(String operation, Mono<T> call) {
        try {
            return call.timeout(requestTimeout).block();
        } catch (WebClientResponseException ex) {
            throw translate(operation, ex);
        } catch (RuntimeException ex) {
            log.debug("Matrix {} failed before a response arrived", operation, ex);
            throw new MatrixRequestException("Matrix " + operation + " failed: " + ex.getMessage(), ex);
        }
    }

    private MatrixRequestException translate(String operation, WebClientResponseException ex) {
        ErrorBody body = parseErrorBody(ex.getResponseBodyAsString());
        String errcode = body != null ? body.errcode() : null;
        String detail = body != null && body.error() != null ? body.error() : ex.getStatusText();
        int status = ex.getStatusCode().value();
        String message = "Matrix " + operation + " failed with " + status + " " + errcode + ": " + detail;
        if (status == HttpStatus.TOO_MANY_REQUESTS.value() || "M_LIMIT_EXCEEDED".equals(errcode)) {
            long retryAfterMs = body != null && body.retryAfterMs() != null ? body.retryAfterMs() : 0L;
            return new MatrixRateLimitedException(message, retryAfterMs);
        }
        if (status == HttpStatus.NOT_FOUND.value()) {
            return new MatrixEventNotFoundException(message, errcode);
        }
        return new MatrixRequestException(message, status, errcode);
    }

    private ErrorBody parseErrorBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, ErrorBody.class);
        } catch (JsonProcessingException e) {
            log.debug("Homeserver error body is not JSON: {}", raw);
            return null;
        }
    }

    String nextTransactionId() {
        return "expirebot." + transactionEpoch + "." + transactionCounter.incrementAndGet();
    }

    // --- Response DTOs --- //
    public record EventResponse(
            @JsonProperty("event_id") String eventId,
            @JsonProperty("type") String type,
            @JsonProperty("origin_server_ts") Long originServerTs
    ) {}

    public record EventIdResponse(@JsonProperty("event_id") String eventId) {}

    public record JoinResponse(@JsonProperty("room_id") String roomId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorBody(
            @JsonProperty("errcode") String errcode,
            @JsonProperty("error") String error,
            @JsonProperty("retry_after_ms") Long retryAfterMs
    ) {}
}
