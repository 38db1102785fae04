package com.example.proctorstream.support;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.auth.Permission;
import com.example.proctorstream.auth.Role;
import com.example.proctorstream.broadcast.ConnectionHandle;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.broadcast.ServerMessage;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Connection stand-in that keeps every message it is sent.
 */
public class RecordingConnection implements ConnectionHandle {

    private final String id;
    private final ConnectionPrincipal principal;
    private final List<ServerMessage> received = new CopyOnWriteArrayList<>();

    public RecordingConnection(String id, ConnectionPrincipal principal) {
        this.id = id;
        this.principal = principal;
    }

    public static RecordingConnection student(String id, String userId) {
        return new RecordingConnection(id, ConnectionPrincipal.builder()
                .userId(userId)
                .role(Role.STUDENT)
                .build());
    }

    public static RecordingConnection observer(String id, String userId, Permission... permissions) {
        Set<Permission> granted = permissions.length == 0 ? Set.of() : EnumSet.of(permissions[0], permissions);
        return new RecordingConnection(id, ConnectionPrincipal.builder()
                .userId(userId)
                .role(Role.OBSERVER)
                .permissions(Set.copyOf(granted))
                .build());
    }

    @Override
    public String getId() { return id; }

    @Override
    public ConnectionPrincipal getPrincipal() { return principal; }

    @Override
    public void send(ServerMessage message) {
        received.add(message);
    }

    public List<ServerMessage> received() {
        return List.copyOf(received);
    }

    public List<ServerEvent> events() {
        return received.stream().map(ServerMessage::getEvent).collect(Collectors.toList());
    }

    public List<ServerMessage> received(ServerEvent event) {
        return received.stream().filter(m -> m.getEvent() == event).collect(Collectors.toList());
    }

    public void clear() {
        received.clear();
    }
}
