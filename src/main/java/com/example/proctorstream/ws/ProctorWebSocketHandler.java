package com.example.proctorstream.ws;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.auth.CredentialGate;
import com.example.proctorstream.auth.CredentialRejectedException;
import com.example.proctorstream.auth.EventRateLimiter;
import com.example.proctorstream.auth.Permission;
import com.example.proctorstream.auth.Role;
import com.example.proctorstream.broadcast.RoomRegistry;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.broadcast.ServerMessage;
import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@code /ws/proctoring}. The credential gate runs before anything else; a refused connection
 * gets one {@code error} frame and is closed. Inbound frames of one connection are handled
 * strictly in arrival order.
 */
@Component
public class ProctorWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ProctorWebSocketHandler.class);

    private final CredentialGate credentialGate;
    private final EventRateLimiter rateLimiter;
    private final RoomRegistry rooms;
    private final StudentEventHandler studentHandler;
    private final ObserverEventHandler observerHandler;
    private final ObjectMapper objectMapper;

    public ProctorWebSocketHandler(CredentialGate credentialGate,
                                   EventRateLimiter rateLimiter,
                                   RoomRegistry rooms,
                                   StudentEventHandler studentHandler,
                                   ObserverEventHandler observerHandler,
                                   ObjectMapper objectMapper) {
        this.credentialGate = credentialGate;
        this.rateLimiter = rateLimiter;
        this.rooms = rooms;
        this.studentHandler = studentHandler;
        this.observerHandler = observerHandler;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        HandshakeInfo handshake = session.getHandshakeInfo();
        ConnectionPrincipal principal;
        try {
            principal = credentialGate.authenticate(handshake.getHeaders(), handshake.getUri());
        } catch (CredentialRejectedException e) {
            logger.info("Refused connection {} from {}: {}", session.getId(), handshake.getRemoteAddress(),
                    e.getReason().getWireName());
            return session.send(Mono.just(session.textMessage(rejectionFrame(e))))
                    .then(session.close(CloseStatus.POLICY_VIOLATION));
        }

        WebSocketConnection connection = new WebSocketConnection(session.getId(), principal, objectMapper);
        rooms.register(connection);
        logger.info("Connection {} opened by {} ({})", connection.getId(), principal.getUserId(),
                principal.getRole().getWireName());

        Map<String, Object> hello = new LinkedHashMap<>();
        hello.put("connectionId", connection.getId());
        hello.put("userId", principal.getUserId());
        hello.put("role", principal.getRole().getWireName());
        if (principal.isObserver()) {
            hello.put("permissions", principal.getPermissions().stream()
                    .map(Permission::getClaimName).sorted().collect(Collectors.toList()));
        }
        connection.send(ServerMessage.of(ServerEvent.CONNECTED, hello));
        if (principal.isObserver()) {
            observerHandler.onConnect(connection);
        }

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> Mono.fromRunnable(() -> dispatch(connection, text))
                        .subscribeOn(Schedulers.boundedElastic()))
                .then()
                .doFinally(signal -> connection.complete());
        Mono<Void> outbound = session.send(connection.frames().map(session::textMessage));

        return Mono.when(inbound, outbound)
                .doFinally(signal -> disconnect(connection));
    }

    void dispatch(WebSocketConnection connection, String text) {
        String eventName = null;
        try {
            ClientMessage message = objectMapper.readValue(text, ClientMessage.class);
            eventName = message.getEvent();
            if (eventName == null || eventName.isBlank()) {
                throw ProctorException.invalidInput("Frame has no event name");
            }
            if (!rateLimiter.tryAcquire(connection.getPrincipal().getUserId())) {
                throw new ProctorException(ErrorCode.RATE_LIMITED, "Too many events, slow down");
            }
            route(connection, eventName, message);
        } catch (ProctorException e) {
            logger.debug("Event {} from {} refused: {}", eventName, connection.getId(), e.getMessage());
            sendError(connection, e.getCode(), e.getMessage(), eventName);
        } catch (JsonProcessingException e) {
            sendError(connection, ErrorCode.INVALID_INPUT, "Frame is not valid JSON", null);
        } catch (Exception e) {
            logger.error("Event {} from {} failed", eventName, connection.getId(), e);
            sendError(connection, ErrorCode.INTERNAL, "Internal error", eventName);
        }
    }

    private void route(WebSocketConnection connection, String eventName, ClientMessage message) {
        Role role = connection.getPrincipal().getRole();
        if (role == Role.STUDENT) {
            StudentEvent event = StudentEvent.fromWire(eventName)
                    .orElseThrow(() -> unknownOrWrongRole(eventName, ObserverEvent.fromWire(eventName).isPresent()));
            studentHandler.handle(connection, event, message.getData());
        } else {
            ObserverEvent event = ObserverEvent.fromWire(eventName)
                    .orElseThrow(() -> unknownOrWrongRole(eventName, StudentEvent.fromWire(eventName).isPresent()));
            observerHandler.handle(connection, event, message.getData());
        }
    }

    private static ProctorException unknownOrWrongRole(String eventName, boolean otherRoleEvent) {
        if (otherRoleEvent) {
            return new ProctorException(ErrorCode.WRONG_ROLE, "Event " + eventName + " is not available to this role");
        }
        return new ProctorException(ErrorCode.UNKNOWN_EVENT, "Unknown event: " + eventName);
    }

    private void sendError(WebSocketConnection connection, ErrorCode code, String message, String eventName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", code.getWireName());
        data.put("message", message);
        if (eventName != null) data.put("event", eventName);
        connection.send(ServerMessage.of(ServerEvent.ERROR, data));
    }

    private void disconnect(WebSocketConnection connection) {
        rooms.unregister(connection.getId());
        try {
            if (connection.getPrincipal().isObserver()) {
                observerHandler.onDisconnect(connection);
            } else {
                studentHandler.onDisconnect(connection);
            }
        } finally {
            logger.info("Connection {} of {} closed", connection.getId(), connection.getPrincipal().getUserId());
        }
    }

    private String rejectionFrame(CredentialRejectedException e) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", e.getReason().getWireName());
        data.put("message", e.getMessage());
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", ServerEvent.ERROR.getWireName());
        frame.put("data", data);
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException ex) {
            return "{\"event\":\"error\",\"data\":{\"code\":\"" + e.getReason().getWireName() + "\"}}";
        }
    }
}
