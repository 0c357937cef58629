package com.roomcast.transport;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.roomcast.exception.ErrorCode;
import com.roomcast.exception.MembershipException;
import com.roomcast.validation.IdentifierValidator;

/**
 * In-memory id to connection map. The host transport attaches sockets when the handshake
 * completes and detaches them when the connection closes.
 */
public class SocketDirectory implements SocketLookup {
    private static final Logger logger = LoggerFactory.getLogger(SocketDirectory.class);

    // Socket ID -> live connection
    private final Map<String, BroadcastSocket> sockets = new ConcurrentHashMap<>();

    /**
     * Attach a live socket. Re-attaching the same instance is a no-op.
     */
    public void attach(BroadcastSocket socket) {
        String socketId = IdentifierValidator.requireSocketId(socket.getId());
        BroadcastSocket existing = sockets.putIfAbsent(socketId, socket);
        if (existing != null && existing != socket) {
            throw new MembershipException(ErrorCode.DUPLICATE_SOCKET, socketId);
        }
        logger.debug("Socket attached: {} (Total: {})", socketId, sockets.size());
    }

    /**
     * Detach a socket by id.
     *
     * @return true if a socket was attached under this id
     */
    public boolean detach(String socketId) {
        boolean removed = socketId != null && sockets.remove(socketId) != null;
        if (removed) {
            logger.debug("Socket detached: {} (Remaining: {})", socketId, sockets.size());
        }
        return removed;
    }

    @Override
    public Optional<BroadcastSocket> findSocket(String socketId) {
        if (socketId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sockets.get(socketId));
    }
}
