package com.roomcast.service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.roomcast.config.RoomcastProperties;
import com.roomcast.model.BroadcastFlags;
import com.roomcast.model.BroadcastOptions;
import com.roomcast.model.Packet;
import com.roomcast.model.PacketOptions;
import com.roomcast.transport.BroadcastSocket;
import com.roomcast.transport.PacketEncoder;

/**
 * Service for delivering packets and bulk actions to resolved targets.
 *
 * <p>Each target is handled independently: a socket that throws is logged and skipped, the
 * remaining targets still receive the action, and nothing is rolled back. Every operation
 * returns the number of sockets it acted on successfully.
 */
@Service
public class BroadcastDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final TargetResolver targetResolver;
    private final PacketEncoder packetEncoder;
    private final RoomcastProperties properties;

    public BroadcastDispatcher(TargetResolver targetResolver, PacketEncoder packetEncoder,
                               RoomcastProperties properties) {
        this.targetResolver = targetResolver;
        this.packetEncoder = packetEncoder;
        this.properties = properties;
    }

    /**
     * Encode a packet once and send it to every resolved target.
     */
    public int broadcast(Packet packet, BroadcastOptions options) {
        BroadcastFlags flags = options.getFlags();
        boolean compress = flags.compress() != null ? flags.compress() : properties.getDispatch().isCompress();
        PacketOptions packetOptions = new PacketOptions(true, flags.volatileDelivery(), compress);

        packet.setNamespace(properties.getNamespace());
        List<byte[]> frames = packetEncoder.encode(packet);

        int delivered = apply(options, "send", socket -> socket.send(frames, packetOptions));
        logger.debug("📤 Broadcast {} to {} socket(s) in {}", packet.getType(), delivered, options);
        return delivered;
    }

    /**
     * Get the ids of the live sockets in any of the given rooms (every socket if empty).
     */
    public Set<String> sockets(Collection<String> rooms) {
        Set<String> ids = new LinkedHashSet<>();
        for (BroadcastSocket socket : targetResolver.resolveSockets(BroadcastOptions.toRooms(rooms))) {
            ids.add(socket.getId());
        }
        return ids;
    }

    /**
     * Get the live sockets matching the given filters.
     */
    public List<BroadcastSocket> fetchSockets(BroadcastOptions options) {
        return targetResolver.resolveSockets(options);
    }

    /**
     * Make the matching sockets join the given rooms.
     */
    public int addSockets(BroadcastOptions options, Collection<String> rooms) {
        Set<String> toJoin = new LinkedHashSet<>(rooms);
        return apply(options, "join", socket -> socket.join(toJoin));
    }

    /**
     * Make the matching sockets leave the given rooms.
     */
    public int delSockets(BroadcastOptions options, Collection<String> rooms) {
        List<String> toLeave = List.copyOf(rooms);
        return apply(options, "leave", socket -> toLeave.forEach(socket::leave));
    }

    /**
     * Make the matching sockets disconnect.
     *
     * @param close whether to close the underlying connection
     */
    public int disconnectSockets(BroadcastOptions options, boolean close) {
        return apply(options, "disconnect", socket -> socket.disconnect(close));
    }

    private int apply(BroadcastOptions options, String action, Consumer<BroadcastSocket> callback) {
        // Targets are resolved before any callback runs, so callbacks that change membership
        // do not affect this pass
        List<BroadcastSocket> targets = targetResolver.resolveSockets(options);
        int succeeded = 0;
        for (BroadcastSocket socket : targets) {
            try {
                callback.accept(socket);
                succeeded++;
            } catch (RuntimeException e) {
                logger.warn("Failed to {} socket {}: {}", action, socket.getId(), e.getMessage());
            }
        }
        if (succeeded < targets.size()) {
            logger.warn("⚠️ {} succeeded for {}/{} socket(s)", action, succeeded, targets.size());
        }
        return succeeded;
    }
}
