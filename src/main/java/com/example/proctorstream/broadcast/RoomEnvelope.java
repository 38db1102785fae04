package com.example.proctorstream.broadcast;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A fan-out request: one message to the union of several rooms. This is also the unit
 * published on the shared bus between instances.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoomEnvelope {
    String originInstance;
    List<RoomKey> rooms;
    @Builder.Default
    Audience audience = Audience.EVERYONE;
    String excludeConnectionId;
    ServerEvent event;
    Map<String, Object> data;
    Instant timestamp;
    // rooms emptied once the message is delivered
    @Builder.Default
    List<RoomKey> dissolveAfter = List.of();

    public ServerMessage toMessage() {
        return new ServerMessage(event, data, timestamp);
    }
}
