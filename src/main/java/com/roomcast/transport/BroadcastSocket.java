package com.roomcast.transport;

import java.util.List;
import java.util.Set;

import com.roomcast.model.PacketOptions;

/**
 * A live, deliverable connection owned by the host transport.
 */
public interface BroadcastSocket {

    String getId();

    /**
     * Queue already-encoded frames for delivery. Must not block on I/O.
     */
    void send(List<byte[]> frames, PacketOptions options);

    void join(Set<String> rooms);

    void leave(String room);

    /**
     * @param close whether to close the underlying connection as well
     */
    void disconnect(boolean close);
}
