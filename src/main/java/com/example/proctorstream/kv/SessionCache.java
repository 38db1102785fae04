package com.example.proctorstream.kv;

import com.example.proctorstream.model.MonitoringSession;

import java.util.Optional;

/**
 * External mirror of session snapshots, read on a local miss so another instance can serve a session.
 */
public interface SessionCache {
    void save(MonitoringSession session);
    Optional<MonitoringSession> load(String sessionId);
    void remove(String sessionId);
}
