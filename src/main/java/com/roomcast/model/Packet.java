package com.roomcast.model;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Application-level packet handed to the dispatcher.
 * The namespace is stamped by the dispatcher just before encoding.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Packet {

    private String type;
    private String namespace;
    private Object data;
    private LocalDateTime timestamp;

    // Default constructor
    public Packet() {
        this.timestamp = LocalDateTime.now();
    }

    public Packet(String type, Object data) {
        this();
        this.type = type;
        this.data = data;
    }

    public static Packet of(String type, Object data) {
        return new Packet(type, data);
    }

    // Getters and Setters
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Object getData() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }
}
