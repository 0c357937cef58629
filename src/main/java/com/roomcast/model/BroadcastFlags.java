package com.roomcast.model;

/**
 * Delivery hints attached to a broadcast.
 *
 * <p>{@code compress} is a {@link Boolean} so that "unset" can fall back to the configured
 * default. {@code local} and {@code broadcast} are passed through untouched; the core never
 * branches on them.
 */
public record BroadcastFlags(boolean volatileDelivery, Boolean compress, boolean local,
                             boolean broadcast, boolean binary) {

    public static final BroadcastFlags NONE = new BroadcastFlags(false, null, false, false, false);
}
