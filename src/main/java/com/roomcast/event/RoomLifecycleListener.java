package com.roomcast.event;

/**
 * Observer of registry mutations.
 *
 * <p>Callbacks run synchronously on the mutating thread, inside the registry's write lock and
 * before the mutating call returns. Within one {@code join} the {@code onRoomCreated} callback
 * for a room always precedes {@code onSocketJoined} for that room, and within one
 * {@code leave} {@code onSocketLeft} precedes {@code onRoomDeleted}.
 *
 * <p>Exceptions thrown by a listener are not caught by the registry; they propagate to the
 * caller that triggered the mutation. Listeners may read the registry but must not mutate it.
 */
public interface RoomLifecycleListener {

    /**
     * Catch-all hook invoked for every event before the typed callback.
     */
    default void onEvent(RoomEvent event) {
    }

    default void onRoomCreated(String room) {
    }

    default void onSocketJoined(String room, String socketId) {
    }

    default void onSocketLeft(String room, String socketId) {
    }

    default void onRoomDeleted(String room) {
    }

    /**
     * Routes an event to {@link #onEvent} and then to the matching typed callback.
     */
    default void dispatch(RoomEvent event) {
        onEvent(event);
        switch (event.type()) {
            case ROOM_CREATED -> onRoomCreated(event.room());
            case SOCKET_JOINED -> onSocketJoined(event.room(), event.socketId());
            case SOCKET_LEFT -> onSocketLeft(event.room(), event.socketId());
            case ROOM_DELETED -> onRoomDeleted(event.room());
        }
    }
}
