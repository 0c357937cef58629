package com.roomcast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Roomcast
 *
 * Roomcast is the room membership and broadcast targeting core of a real-time messaging layer:
 * - MembershipRegistry tracks which sockets are in which rooms
 * - TargetResolver turns rooms / except / merge filters into target sockets
 * - BroadcastDispatcher encodes a packet once and hands it to each target
 *
 * The network transport is supplied by the host through SocketLookup and BroadcastSocket.
 */
@SpringBootApplication
public class RoomcastApplication {

	public static void main(String[] args) {
		SpringApplication.run(RoomcastApplication.class, args);
	}
}
