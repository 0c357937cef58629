package com.roomcast.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.roomcast.event.RoomEvent;
import com.roomcast.event.RoomLifecycleListener;
import com.roomcast.validation.IdentifierValidator;

/**
 * Bidirectional index of room and socket membership.
 *
 * <p>Two maps are kept in step under a single read/write lock:
 * <ul>
 *   <li>{@code rooms}: room -> sockets. A room is present iff it has at least one member.</li>
 *   <li>{@code sids}: socket -> rooms. A socket is present from its first join (or
 *       {@link #register}) until {@link #removeSocket}.</li>
 * </ul>
 * For every room r and socket s, {@code s ∈ rooms[r]} iff {@code r ∈ sids[s]}; each mutation
 * updates both maps before any listener is notified.
 *
 * <p>Listeners are notified synchronously while the write lock is held. A listener exception
 * propagates to the caller; the index stays consistent because every per-room step completes
 * before its events are emitted.
 */
@Service
public class MembershipRegistry {
    private static final Logger logger = LoggerFactory.getLogger(MembershipRegistry.class);

    // Room -> member socket IDs
    private final Map<String, Set<String>> rooms = new HashMap<>();

    // Socket ID -> joined rooms
    private final Map<String, Set<String>> sids = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<RoomLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(RoomLifecycleListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(RoomLifecycleListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Create an empty entry for a socket without joining any room. No events are emitted.
     */
    public void register(String socketId) {
        IdentifierValidator.requireSocketId(socketId);
        lock.writeLock().lock();
        try {
            sids.computeIfAbsent(socketId, k -> new LinkedHashSet<>());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Add a socket to each of the given rooms. Rooms the socket is already in are skipped.
     */
    public void join(String socketId, Collection<String> roomsToJoin) {
        IdentifierValidator.requireSocketId(socketId);
        IdentifierValidator.requireRooms(roomsToJoin);

        lock.writeLock().lock();
        try {
            Set<String> joined = sids.computeIfAbsent(socketId, k -> new LinkedHashSet<>());
            for (String room : roomsToJoin) {
                joined.add(room);

                boolean created = false;
                Set<String> members = rooms.get(room);
                if (members == null) {
                    members = new LinkedHashSet<>();
                    rooms.put(room, members);
                    created = true;
                }
                boolean added = members.add(socketId);

                if (created) {
                    emit(RoomEvent.roomCreated(room));
                }
                if (added) {
                    emit(RoomEvent.socketJoined(room, socketId));
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void join(String socketId, String room) {
        join(socketId, List.of(IdentifierValidator.requireRoom(room)));
    }

    /**
     * Remove a socket from a room. The room is deleted when its last member leaves.
     */
    public void leave(String socketId, String room) {
        IdentifierValidator.requireSocketId(socketId);
        IdentifierValidator.requireRoom(room);

        lock.writeLock().lock();
        try {
            Set<String> joined = sids.get(socketId);
            if (joined != null) {
                joined.remove(room);
            }
            removeFromRoom(room, socketId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a socket from every room it has joined and forget it entirely.
     * Unknown sockets are ignored; a null id is rejected like in {@link #join}.
     */
    public void removeSocket(String socketId) {
        IdentifierValidator.requireSocketId(socketId);

        lock.writeLock().lock();
        try {
            Set<String> joined = sids.get(socketId);
            if (joined == null) {
                return;
            }
            for (String room : new ArrayList<>(joined)) {
                joined.remove(room);
                removeFromRoom(room, socketId);
            }
            sids.remove(socketId);
            logger.debug("Socket removed: {} (Total sockets: {}, rooms: {})", socketId, sids.size(), rooms.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private void removeFromRoom(String room, String socketId) {
        Set<String> members = rooms.get(room);
        if (members == null) {
            return;
        }
        boolean removed = members.remove(socketId);
        boolean emptied = members.isEmpty();
        if (emptied) {
            rooms.remove(room);
        }

        if (removed) {
            emit(RoomEvent.socketLeft(room, socketId));
        }
        if (emptied) {
            emit(RoomEvent.roomDeleted(room));
        }
    }

    private void emit(RoomEvent event) {
        for (RoomLifecycleListener listener : listeners) {
            listener.dispatch(event);
        }
    }

    /**
     * Get the rooms a socket has joined.
     *
     * @return empty if the socket was never registered; an empty set if it is registered
     *         but currently in no room
     */
    public Optional<Set<String>> roomsOf(String socketId) {
        lock.readLock().lock();
        try {
            Set<String> joined = sids.get(socketId);
            return joined == null ? Optional.empty() : Optional.of(Set.copyOf(joined));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get a snapshot of a room's members, empty if the room does not exist.
     */
    public Set<String> members(String room) {
        lock.readLock().lock();
        try {
            Set<String> members = rooms.get(room);
            return members == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(members));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasRoom(String room) {
        lock.readLock().lock();
        try {
            return rooms.containsKey(room);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get all existing room names.
     */
    public Set<String> rooms() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(rooms.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get every registered socket id, including sockets in no room.
     */
    public Set<String> socketIds() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(sids.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int roomCount() {
        lock.readLock().lock();
        try {
            return rooms.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int socketCount() {
        lock.readLock().lock();
        try {
            return sids.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run a multi-step read against one consistent state. Mutations wait until it returns.
     */
    public <T> T readLocked(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
