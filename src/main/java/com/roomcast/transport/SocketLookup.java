package com.roomcast.transport;

import java.util.Optional;

/**
 * Resolves a socket id to its live connection.
 * An empty result means the connection is gone; callers skip it.
 */
@FunctionalInterface
public interface SocketLookup {

    Optional<BroadcastSocket> findSocket(String socketId);
}
