package com.example.proctorstream.broadcast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Structured room name. Scoped types carry an id; the two singleton rooms do not, so
 * namespaces can never collide.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoomKey {

    private static final RoomKey OBSERVER_GLOBAL = new RoomKey(RoomType.OBSERVER_GLOBAL, null);
    private static final RoomKey STATS_SUBSCRIBERS = new RoomKey(RoomType.STATS_SUBSCRIBERS, null);

    RoomType type;
    String id;

    public static RoomKey session(String sessionId) {
        return new RoomKey(RoomType.SESSION, requireId(sessionId));
    }

    public static RoomKey observerExam(String examId) {
        return new RoomKey(RoomType.OBSERVER_EXAM, requireId(examId));
    }

    public static RoomKey observerGlobal() {
        return OBSERVER_GLOBAL;
    }

    public static RoomKey statsSubscribers() {
        return STATS_SUBSCRIBERS;
    }

    private static String requireId(String id) {
        Objects.requireNonNull(id, "room id");
        if (id.isBlank()) throw new IllegalArgumentException("room id must not be blank");
        return id;
    }

    @JsonValue
    public String name() {
        return type.isScoped() ? type.getPrefix() + ":" + id : type.getPrefix();
    }

    @JsonCreator
    public static RoomKey parse(String name) {
        for (RoomType type : RoomType.values()) {
            if (!type.isScoped() && type.getPrefix().equals(name)) {
                return type == RoomType.OBSERVER_GLOBAL ? OBSERVER_GLOBAL : STATS_SUBSCRIBERS;
            }
            String prefix = type.getPrefix() + ":";
            if (type.isScoped() && name.startsWith(prefix)) {
                return new RoomKey(type, requireId(name.substring(prefix.length())));
            }
        }
        throw new IllegalArgumentException("Unknown room: " + name);
    }

    @Override
    public String toString() {
        return name();
    }
}
