package com.expirebot.expiry.health;

import com.expirebot.expiry.sweep.ExpirySweeper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight unauthenticated health endpoint, with the outcome of the most recent sweep.
 * Distinct from Actuator which remains internal-focused.
 */
@RestController
public class HealthzController {

    private final ExpirySweeper sweeper;

    public HealthzController(ExpirySweeper sweeper) {
        this.sweeper = sweeper;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        sweeper.lastSummary().ifPresent(summary -> {
            body.put("lastSweepAt", summary.startedAt().toString());
            body.put("lastSweepTracked", summary.candidates());
            body.put("lastSweepRedacted", summary.evicted());
        });
        return body;
    }
}
