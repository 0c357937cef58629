package com.roomcast.transport;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomcast.exception.ErrorCode;
import com.roomcast.exception.MembershipException;
import com.roomcast.model.Packet;

/**
 * Default encoder: one UTF-8 JSON frame per packet.
 */
public class JacksonPacketEncoder implements PacketEncoder {

    private final ObjectMapper objectMapper;

    public JacksonPacketEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<byte[]> encode(Packet packet) {
        try {
            return List.of(objectMapper.writeValueAsBytes(packet));
        } catch (JsonProcessingException e) {
            throw new MembershipException(ErrorCode.ENCODING_FAILED,
                    "packet type " + packet.getType(), e);
        }
    }
}
