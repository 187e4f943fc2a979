package com.flagship.prior_auth.health;

import com.flagship.prior_auth.integration.resilience.ResiliencePolicy;
import com.flagship.prior_auth.integration.resilience.ResiliencePolicyRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness and readiness checks.
 * Unlike the Actuator health endpoint, this does not require authorization.
 *
 * An open upstream breaker does not make the service DOWN: requests that need no
 * gateway call still succeed.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final ResiliencePolicyRegistry policies;

    public HealthController(DataSource dataSource, ResiliencePolicyRegistry policies) {
        this.dataSource = dataSource;
        this.policies = policies;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        Map<String, String> upstreams = new LinkedHashMap<>();
        for (ResiliencePolicy policy : policies.all()) {
            upstreams.put(policy.getUpstream(), policy.getState().name());
        }
        response.put("upstreams", upstreams);

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
