package com.example.proctorstream.broadcast;

import com.example.proctorstream.auth.ConnectionPrincipal;

/**
 * A live client connection on this instance.
 */
public interface ConnectionHandle {
    String getId();
    ConnectionPrincipal getPrincipal();
    void send(ServerMessage message);
}
