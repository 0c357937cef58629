package com.roomcast.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.roomcast.model.BroadcastOptions;
import com.roomcast.transport.BroadcastSocket;
import com.roomcast.transport.SocketLookup;

/**
 * Computes the target sockets of a broadcast from the membership registry.
 */
@Service
public class TargetResolver {
    private static final Logger logger = LoggerFactory.getLogger(TargetResolver.class);

    private final MembershipRegistry registry;
    private final SocketLookup socketLookup;

    public TargetResolver(MembershipRegistry registry, SocketLookup socketLookup) {
        this.registry = registry;
        this.socketLookup = socketLookup;
    }

    /**
     * Resolve the target socket ids of a broadcast, in first-seen order.
     *
     * <p>An empty {@code rooms} set targets every registered socket. Exclusion always wins
     * over inclusion. When {@code merge} is non-empty a candidate must belong to all of its
     * rooms.
     */
    public Set<String> resolve(BroadcastOptions options) {
        return registry.readLocked(() -> {
            Set<String> excluded = exceptedSockets(options.getExcept());
            Set<String> targets = new LinkedHashSet<>();

            if (options.getRooms().isEmpty()) {
                for (String socketId : registry.socketIds()) {
                    if (!excluded.contains(socketId)) {
                        targets.add(socketId);
                    }
                }
                return targets;
            }

            Set<String> required = options.getMerge().isEmpty() ? null : intersectMembers(options.getMerge());
            for (String room : options.getRooms()) {
                for (String socketId : registry.members(room)) {
                    if (excluded.contains(socketId)) {
                        continue;
                    }
                    if (required != null && !required.contains(socketId)) {
                        continue;
                    }
                    targets.add(socketId);
                }
            }
            return targets;
        });
    }

    /**
     * Resolve the targets to live sockets. Ids the transport no longer knows are skipped.
     */
    public List<BroadcastSocket> resolveSockets(BroadcastOptions options) {
        Set<String> ids = resolve(options);
        List<BroadcastSocket> sockets = new ArrayList<>(ids.size());
        int missing = 0;
        for (String socketId : ids) {
            Optional<BroadcastSocket> socket = socketLookup.findSocket(socketId);
            if (socket.isPresent()) {
                sockets.add(socket.get());
            } else {
                missing++;
            }
        }
        if (missing > 0) {
            logger.debug("Skipped {} socket(s) with no live connection for {}", missing, options);
        }
        return sockets;
    }

    /**
     * Sockets that are members of every given room.
     * If any room does not exist the intersection is empty.
     */
    public Set<String> intersectMembers(Set<String> mergeRooms) {
        return registry.readLocked(() -> {
            if (mergeRooms.isEmpty()) {
                return Collections.<String>emptySet();
            }
            Set<String> result = null;
            for (String room : mergeRooms) {
                if (!registry.hasRoom(room)) {
                    return Collections.<String>emptySet();
                }
                Set<String> members = registry.members(room);
                if (result == null) {
                    result = new LinkedHashSet<>(members);
                } else {
                    result.retainAll(members);
                }
                if (result.isEmpty()) {
                    break;
                }
            }
            return result;
        });
    }

    private Set<String> exceptedSockets(Set<String> exceptRooms) {
        Set<String> excluded = new LinkedHashSet<>();
        for (String room : exceptRooms) {
            excluded.addAll(registry.members(room));
        }
        return excluded;
    }
}
