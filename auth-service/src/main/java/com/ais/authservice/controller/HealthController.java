package com.ais.authservice.controller;

import com.ais.authservice.config.AuthProperties;
import com.ais.authservice.dto.HealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 5;

    private final AuthProperties authProperties;
    private final DataSource dataSource;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
                .status("healthy")
                .service(authProperties.appName())
                .version(authProperties.version())
                .build());
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean dbHealthy = isDatabaseReachable();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", dbHealthy ? "ready" : "not_ready");
        response.put("checks", Map.of("database", dbHealthy));

        HttpStatus status = dbHealthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    private boolean isDatabaseReachable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(DB_VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Readiness check failed - database unreachable: {}", e.getMessage());
            return false;
        }
    }
}
