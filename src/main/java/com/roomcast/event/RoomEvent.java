package com.roomcast.event;

import java.util.Objects;

/**
 * A single membership lifecycle event.
 * {@code socketId} is null for room-level events.
 */
public record RoomEvent(RoomEventType type, String room, String socketId) {

    public RoomEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(room, "room");
    }

    public static RoomEvent roomCreated(String room) {
        return new RoomEvent(RoomEventType.ROOM_CREATED, room, null);
    }

    public static RoomEvent socketJoined(String room, String socketId) {
        return new RoomEvent(RoomEventType.SOCKET_JOINED, room, socketId);
    }

    public static RoomEvent socketLeft(String room, String socketId) {
        return new RoomEvent(RoomEventType.SOCKET_LEFT, room, socketId);
    }

    public static RoomEvent roomDeleted(String room) {
        return new RoomEvent(RoomEventType.ROOM_DELETED, room, null);
    }
}
