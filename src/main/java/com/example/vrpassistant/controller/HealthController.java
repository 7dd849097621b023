package com.example.vrpassistant.controller;

import com.example.vrpassistant.context.ContextStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ContextStore contextStore;

    public HealthController(ContextStore contextStore) {
        this.contextStore = contextStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "vrp-assistant");
        health.put("version", "0.1.0");

        try {
            health.put("activeSessions", contextStore.size());
            health.put("contextStore", "UP");
        } catch (Exception e) {
            health.put("contextStore", "DOWN");
            health.put("contextStoreError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }

    @GetMapping("/vrp/health")
    public ResponseEntity<Map<String, Object>> vrpHealth() {
        return health();
    }
}
