package com.roomcast;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import com.roomcast.event.RecordingListener;
import com.roomcast.event.RoomEvent;
import com.roomcast.model.BroadcastOptions;
import com.roomcast.model.Packet;
import com.roomcast.service.BroadcastDispatcher;
import com.roomcast.service.MembershipRegistry;
import com.roomcast.transport.BroadcastSocket;
import com.roomcast.transport.FakeSocket;
import com.roomcast.transport.PacketEncoder;
import com.roomcast.transport.SocketDirectory;
import com.roomcast.transport.SocketLookup;

@SpringBootTest
class HostTransportOverrideTests {

    static final Map<String, BroadcastSocket> HOST_SOCKETS = new ConcurrentHashMap<>();

    @TestConfiguration
    static class HostTransportConfig {

        @Bean
        SocketLookup hostLookup() {
            return socketId -> Optional.ofNullable(HOST_SOCKETS.get(socketId));
        }

        @Bean
        PacketEncoder hostEncoder() {
            return packet -> List.of(("host:" + packet.getType()).getBytes(StandardCharsets.UTF_8));
        }

        @Bean
        RecordingListener recordingListener() {
            return new RecordingListener();
        }
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SocketLookup socketLookup;

    @Autowired
    private PacketEncoder packetEncoder;

    @Autowired
    private MembershipRegistry registry;

    @Autowired
    private BroadcastDispatcher dispatcher;

    @Autowired
    private RecordingListener recordingListener;

    @AfterEach
    void tearDown() {
        HOST_SOCKETS.keySet().forEach(registry::removeSocket);
        HOST_SOCKETS.clear();
    }

    @Test
    void hostBeansReplaceTheDefaults() {
        assertThat(context.getBeansOfType(SocketLookup.class)).containsOnlyKeys("hostLookup");
        assertThat(context.getBeansOfType(SocketDirectory.class)).isEmpty();
        assertThat(context.getBeansOfType(PacketEncoder.class)).containsOnlyKeys("hostEncoder");
        assertThat(socketLookup).isSameAs(context.getBean("hostLookup"));
        assertThat(packetEncoder).isSameAs(context.getBean("hostEncoder"));
    }

    @Test
    void broadcastUsesHostLookupAndEncoder() {
        FakeSocket socket = new FakeSocket("host-A", registry);
        HOST_SOCKETS.put("host-A", socket);
        registry.join("host-A", Set.of("host-room"));
        registry.join("host-missing", Set.of("host-room"));

        int delivered = dispatcher.broadcast(Packet.of("ping", null), BroadcastOptions.toRooms("host-room"));

        assertThat(delivered).isEqualTo(1);
        assertThat(new String(socket.getSent().get(0).get(0), StandardCharsets.UTF_8)).isEqualTo("host:ping");
        registry.removeSocket("host-missing");
    }

    @Test
    void hostListenerBeanIsAttachedToTheRegistry() {
        recordingListener.clear();

        registry.join("host-B", Set.of("host-events"));
        registry.removeSocket("host-B");

        assertThat(recordingListener.getEvents()).containsExactly(
                RoomEvent.roomCreated("host-events"),
                RoomEvent.socketJoined("host-events", "host-B"),
                RoomEvent.socketLeft("host-events", "host-B"),
                RoomEvent.roomDeleted("host-events"));
    }
}
