package com.roomcast.model;

/**
 * Per-delivery options handed to the transport with each send.
 */
public record PacketOptions(boolean preEncoded, boolean volatileDelivery, boolean compress) {
}
