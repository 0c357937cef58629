package com.roomcast.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every lifecycle event to the log at DEBUG.
 */
public class LoggingLifecycleListener implements RoomLifecycleListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingLifecycleListener.class);

    @Override
    public void onRoomCreated(String room) {
        logger.debug("📦 Room created: {}", room);
    }

    @Override
    public void onSocketJoined(String room, String socketId) {
        logger.debug("👋 Socket {} joined room {}", socketId, room);
    }

    @Override
    public void onSocketLeft(String room, String socketId) {
        logger.debug("🚪 Socket {} left room {}", socketId, room);
    }

    @Override
    public void onRoomDeleted(String room) {
        logger.debug("🗑️ Room deleted: {}", room);
    }
}
