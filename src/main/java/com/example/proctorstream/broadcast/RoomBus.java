package com.example.proctorstream.broadcast;

/**
 * Carries a fan-out request to every instance that may hold members of its rooms.
 */
public interface RoomBus {
    void publish(RoomEnvelope envelope);
}
