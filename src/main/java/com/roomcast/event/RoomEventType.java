package com.roomcast.event;

/**
 * The four membership lifecycle events.
 */
public enum RoomEventType {
    ROOM_CREATED,
    SOCKET_JOINED,
    SOCKET_LEFT,
    ROOM_DELETED
}
