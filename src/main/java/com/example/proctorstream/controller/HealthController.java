package com.example.proctorstream.controller;

import com.example.proctorstream.repo.OutboxRepo;
import com.example.proctorstream.service.DashboardService;
import com.example.proctorstream.service.DownstreamDispatcher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ObjectProvider<StringRedisTemplate> redis;
    private final OutboxRepo outboxRepo;
    private final DashboardService dashboard;
    private final DownstreamDispatcher dispatcher;

    public HealthController(ObjectProvider<StringRedisTemplate> redis,
                            OutboxRepo outboxRepo,
                            DashboardService dashboard,
                            DownstreamDispatcher dispatcher) {
        this.redis = redis;
        this.outboxRepo = outboxRepo;
        this.dashboard = dashboard;
        this.dispatcher = dispatcher;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "proctor-stream");
        health.put("version", "1.0.0");
        health.put("statistics", dashboard.statistics());
        health.put("downstream", dispatcher.getDispatchStats());

        // Redis backs the session mirror and the shared room bus
        StringRedisTemplate template = redis.getIfAvailable();
        if (template == null) {
            health.put("redis", "NOT_CONFIGURED");
        } else {
            try {
                template.hasKey("health-check");
                health.put("redis", "UP");
            } catch (Exception e) {
                health.put("redis", "DOWN");
                health.put("redisError", e.getMessage());
            }
        }

        // MongoDB holds the downstream outbox
        try {
            outboxRepo.countByProcessedFalse();
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
