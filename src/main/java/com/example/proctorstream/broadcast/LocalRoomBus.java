package com.example.proctorstream.broadcast;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-instance bus: delivers straight to this instance's rooms.
 */
@Component
@ConditionalOnProperty(name = "app.broadcast.bus", havingValue = "local", matchIfMissing = true)
public class LocalRoomBus implements RoomBus {

    private final RoomRegistry rooms;

    public LocalRoomBus(RoomRegistry rooms) {
        this.rooms = rooms;
    }

    @Override
    public void publish(RoomEnvelope envelope) {
        rooms.deliver(envelope);
    }
}
