package com.example.driftmonitor.controller;

import com.example.driftmonitor.kv.KvClient;
import com.example.driftmonitor.store.LogAccessor;
import com.example.driftmonitor.store.LogStream;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final LogAccessor logAccessor;

    public HealthController(KvClient kvClient, LogAccessor logAccessor) {
        this.kvClient = kvClient;
        this.logAccessor = logAccessor;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "drift-monitor");
        health.put("version", "0.1.0");

        // Redis backs the action ledger
        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            health.put("interactionLog", logAccessor.streamExists(LogStream.INTERACTIONS) ? "PRESENT" : "MISSING");
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
