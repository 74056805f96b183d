package com.bastion.authservice.api;

import com.bastion.authservice.config.AuthProperties;
import com.bastion.authservice.config.ServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status and diagnostic endpoints. {@code /unauthorized} and {@code /forbidden} always answer
 * with the matching error so clients can check how they render it.
 */
@RestController
@RequestMapping("/api/v1")
public class StatusController {

    private final ServiceProperties serviceProperties;
    private final AuthProperties authProperties;

    public StatusController(ServiceProperties serviceProperties, AuthProperties authProperties) {
        this.serviceProperties = serviceProperties;
        this.authProperties = authProperties;
    }

    @GetMapping("/status")
    public Map<String, String> status() {
        return Map.of("status", "OK");
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", serviceProperties.name(),
                "environment", serviceProperties.environment(),
                "description", serviceProperties.description(),
                "authType", authProperties.type().name().toLowerCase(),
                "timestamp", Instant.now().toString());
    }

    @GetMapping("/unauthorized")
    public ResponseEntity<Map<String, String>> unauthorized() {
        return error(HttpStatus.UNAUTHORIZED);
    }

    @GetMapping("/forbidden")
    public ResponseEntity<Map<String, String>> forbidden() {
        return error(HttpStatus.FORBIDDEN);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status) {
        return ResponseEntity.status(status).body(Map.of("error", status.getReasonPhrase()));
    }
}
