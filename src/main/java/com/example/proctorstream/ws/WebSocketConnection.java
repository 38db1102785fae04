package com.example.proctorstream.ws;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.broadcast.ConnectionHandle;
import com.example.proctorstream.broadcast.ServerMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outbound side of one socket. Frames are serialized here and buffered in a unicast sink the
 * socket drains; {@link #send} may be called from any thread.
 */
public class WebSocketConnection implements ConnectionHandle {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConnection.class);

    private final String id;
    private final ConnectionPrincipal principal;
    private final ObjectMapper objectMapper;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
    // session joined by a student connection
    private final AtomicReference<String> boundSessionId = new AtomicReference<>();

    public WebSocketConnection(String id, ConnectionPrincipal principal, ObjectMapper objectMapper) {
        this.id = id;
        this.principal = principal;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() { return id; }

    @Override
    public ConnectionPrincipal getPrincipal() { return principal; }

    @Override
    public void send(ServerMessage message) {
        String frame;
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("event", message.getEvent().getWireName());
            body.put("data", message.getData());
            body.put("timestamp", message.getTimestamp());
            frame = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            logger.error("Could not encode {} for {}", message.getEvent().getWireName(), id, e);
            return;
        }
        Sinks.EmitResult result;
        synchronized (outbound) {
            result = outbound.tryEmitNext(frame);
        }
        if (result.isFailure()) {
            logger.debug("Dropped {} for {}: {}", message.getEvent().getWireName(), id, result);
        }
    }

    public Flux<String> frames() {
        return outbound.asFlux();
    }

    public void complete() {
        synchronized (outbound) {
            outbound.tryEmitComplete();
        }
    }

    public String getBoundSessionId() { return boundSessionId.get(); }

    public void bindSession(String sessionId) {
        boundSessionId.set(sessionId);
    }
}
