package com.roomcast.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class RoomLifecycleListenerTest {

    @Test
    void dispatchCallsCatchAllThenTypedCallback() {
        List<String> calls = new ArrayList<>();
        RoomLifecycleListener listener = new RoomLifecycleListener() {
            @Override
            public void onEvent(RoomEvent event) {
                calls.add("event:" + event.type());
            }

            @Override
            public void onSocketJoined(String room, String socketId) {
                calls.add("joined:" + room + ":" + socketId);
            }

            @Override
            public void onRoomDeleted(String room) {
                calls.add("deleted:" + room);
            }
        };

        listener.dispatch(RoomEvent.socketJoined("lobby", "s1"));
        listener.dispatch(RoomEvent.roomDeleted("lobby"));

        assertThat(calls).containsExactly(
                "event:SOCKET_JOINED", "joined:lobby:s1",
                "event:ROOM_DELETED", "deleted:lobby");
    }

    @Test
    void roomEventsCarrySocketOnlyForMembershipChanges() {
        assertThat(RoomEvent.roomCreated("r").socketId()).isNull();
        assertThat(RoomEvent.roomDeleted("r").socketId()).isNull();
        assertThat(RoomEvent.socketLeft("r", "s").socketId()).isEqualTo("s");
        assertThat(RoomEvent.socketLeft("r", "s").type()).isEqualTo(RoomEventType.SOCKET_LEFT);
    }
}
