package com.roomcast.exception;

/**
 * Standardized error codes raised by the membership core.
 */
public enum ErrorCode {
    // Identifier errors (ID_XXX)
    INVALID_SOCKET_ID("ID_001", "Invalid socket id"),
    INVALID_ROOM("ID_002", "Invalid room name"),

    // Transport errors (TRN_XXX)
    DUPLICATE_SOCKET("TRN_001", "Socket id already attached"),
    ENCODING_FAILED("TRN_002", "Packet encoding failed");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
