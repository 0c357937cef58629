package com.roomcast.validation;

import java.util.Collection;

import com.roomcast.exception.ErrorCode;
import com.roomcast.exception.MembershipException;

/**
 * Centralized validation for socket ids and room names.
 * Both are opaque strings, the empty string included; only null is refused.
 */
public final class IdentifierValidator {

    private IdentifierValidator() {
    }

    /**
     * Validate a socket id.
     */
    public static String requireSocketId(String socketId) {
        if (socketId == null) {
            throw new MembershipException(ErrorCode.INVALID_SOCKET_ID, "Socket id is required");
        }
        return socketId;
    }

    /**
     * Validate a room name.
     */
    public static String requireRoom(String room) {
        if (room == null) {
            throw new MembershipException(ErrorCode.INVALID_ROOM, "Room name is required");
        }
        return room;
    }

    /**
     * Validate every room of a collection before any of them is used.
     */
    public static void requireRooms(Collection<String> rooms) {
        if (rooms == null) {
            throw new MembershipException(ErrorCode.INVALID_ROOM, "Room set is required");
        }
        for (String room : rooms) {
            requireRoom(room);
        }
    }
}
