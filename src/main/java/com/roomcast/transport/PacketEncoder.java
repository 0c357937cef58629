package com.roomcast.transport;

import java.util.List;

import com.roomcast.model.Packet;

/**
 * Serializes a packet into transport-ready frames. Invoked once per broadcast.
 */
@FunctionalInterface
public interface PacketEncoder {

    List<byte[]> encode(Packet packet);
}
