package com.example.proctorstream.kv;

import com.example.proctorstream.model.MonitoringSession;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@ConditionalOnProperty(name = "app.registry.cache", havingValue = "none", matchIfMissing = true)
public class NoOpSessionCache implements SessionCache {

    @Override
    public void save(MonitoringSession session) {
    }

    @Override
    public Optional<MonitoringSession> load(String sessionId) {
        return Optional.empty();
    }

    @Override
    public void remove(String sessionId) {
    }
}
