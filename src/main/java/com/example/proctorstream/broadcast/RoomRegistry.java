package com.example.proctorstream.broadcast;

import com.example.proctorstream.auth.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Room membership of the connections held by this instance. Join and leave are idempotent;
 * a connection may sit in any number of rooms.
 */
@Component
public class RoomRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, ConnectionHandle> connections = new ConcurrentHashMap<>();
    private final Map<RoomKey, Set<String>> members = new ConcurrentHashMap<>();
    private final Map<String, Set<RoomKey>> roomsByConnection = new ConcurrentHashMap<>();

    public void register(ConnectionHandle handle) {
        connections.put(handle.getId(), handle);
        roomsByConnection.computeIfAbsent(handle.getId(), k -> ConcurrentHashMap.newKeySet());
    }

    /**
     * Drops the connection and every membership it held.
     *
     * @return the rooms the connection was in
     */
    public Set<RoomKey> unregister(String connectionId) {
        connections.remove(connectionId);
        Set<RoomKey> rooms = roomsByConnection.remove(connectionId);
        if (rooms == null) return Set.of();
        for (RoomKey room : rooms) {
            removeMember(room, connectionId);
        }
        return Set.copyOf(rooms);
    }

    /**
     * @return true when the connection was not yet a member
     */
    public boolean join(String connectionId, RoomKey room) {
        if (!connections.containsKey(connectionId)) {
            throw new IllegalStateException("Connection not registered: " + connectionId);
        }
        boolean added = members.computeIfAbsent(room, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
        roomsByConnection.computeIfAbsent(connectionId, k -> ConcurrentHashMap.newKeySet()).add(room);
        if (added) {
            logger.debug("Connection {} joined {}", connectionId, room);
        }
        return added;
    }

    public boolean leave(String connectionId, RoomKey room) {
        Set<RoomKey> rooms = roomsByConnection.get(connectionId);
        if (rooms != null) rooms.remove(room);
        boolean removed = removeMember(room, connectionId);
        if (removed) {
            logger.debug("Connection {} left {}", connectionId, room);
        }
        return removed;
    }

    private boolean removeMember(RoomKey room, String connectionId) {
        boolean[] removed = {false};
        members.computeIfPresent(room, (k, set) -> {
            removed[0] = set.remove(connectionId);
            return set.isEmpty() ? null : set;
        });
        return removed[0];
    }

    /**
     * Removes every member of the room.
     */
    public void dissolve(RoomKey room) {
        Set<String> ids = members.remove(room);
        if (ids == null) return;
        for (String id : ids) {
            Set<RoomKey> rooms = roomsByConnection.get(id);
            if (rooms != null) rooms.remove(room);
        }
        logger.debug("Dissolved {} ({} members)", room, ids.size());
    }

    /**
     * Delivers the envelope to local members of its rooms, once per connection.
     *
     * @return number of connections reached
     */
    public int deliver(RoomEnvelope envelope) {
        Map<String, ConnectionHandle> targets = new LinkedHashMap<>();
        for (RoomKey room : envelope.getRooms()) {
            for (String id : members.getOrDefault(room, Set.of())) {
                if (id.equals(envelope.getExcludeConnectionId())) continue;
                ConnectionHandle handle = connections.get(id);
                if (handle != null && envelope.getAudience().admits(handle.getPrincipal().getRole())) {
                    targets.putIfAbsent(id, handle);
                }
            }
        }
        ServerMessage message = envelope.toMessage();
        for (ConnectionHandle handle : targets.values()) {
            try {
                handle.send(message);
            } catch (Exception e) {
                logger.warn("Delivery of {} to {} failed: {}", message.getEvent().getWireName(), handle.getId(), e.getMessage());
            }
        }
        envelope.getDissolveAfter().forEach(this::dissolve);
        return targets.size();
    }

    public Optional<ConnectionHandle> connection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Set<RoomKey> roomsOf(String connectionId) {
        Set<RoomKey> rooms = roomsByConnection.get(connectionId);
        return rooms == null ? Set.of() : Set.copyOf(rooms);
    }

    public List<ConnectionHandle> members(RoomKey room) {
        return members.getOrDefault(room, Set.of()).stream()
                .map(connections::get)
                .filter(h -> h != null)
                .collect(Collectors.toList());
    }

    public boolean isMember(String connectionId, RoomKey room) {
        return members.getOrDefault(room, Set.of()).contains(connectionId);
    }

    public Map<Role, Long> countByRole() {
        Collection<ConnectionHandle> all = connections.values();
        return all.stream().collect(Collectors.groupingBy(h -> h.getPrincipal().getRole(), Collectors.counting()));
    }

    public int roomCount() {
        return members.size();
    }
}
