package com.example.proctorstream.kv;

import com.example.proctorstream.model.MonitoringSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Writes session snapshots through to Redis as JSON under {@code proctor:session:{id}}.
 * The key expires after the inactivity timeout, so an abandoned session disappears from Redis
 * on its own. Redis trouble is logged and otherwise ignored.
 */
@Component
@ConditionalOnProperty(name = "app.registry.cache", havingValue = "redis")
public class RedisSessionCache implements SessionCache {

    private static final Logger logger = LoggerFactory.getLogger(RedisSessionCache.class);
    static final String KEY_PREFIX = "proctor:session:";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisSessionCache(StringRedisTemplate redis,
                             ObjectMapper objectMapper,
                             @Value("${app.registry.inactivity-timeout-ms:7200000}") long inactivityTimeoutMs) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofMillis(inactivityTimeoutMs);
    }

    @Override
    public void save(MonitoringSession session) {
        try {
            String json = objectMapper.writeValueAsString(session);
            if (ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(key(session.getSessionId()), json);
            } else {
                redis.opsForValue().set(key(session.getSessionId()), json, ttl);
            }
        } catch (Exception e) {
            logger.warn("Session mirror write failed for {}: {}", session.getSessionId(), e.getMessage());
        }
    }

    @Override
    public Optional<MonitoringSession> load(String sessionId) {
        try {
            String json = redis.opsForValue().get(key(sessionId));
            if (json == null) return Optional.empty();
            return Optional.of(objectMapper.readValue(json, MonitoringSession.class));
        } catch (Exception e) {
            logger.warn("Session mirror read failed for {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void remove(String sessionId) {
        try {
            redis.delete(key(sessionId));
        } catch (Exception e) {
            logger.warn("Session mirror delete failed for {}: {}", sessionId, e.getMessage());
        }
    }

    private static String key(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
