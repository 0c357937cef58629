package com.roomcast.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.roomcast.exception.ErrorCode;
import com.roomcast.exception.MembershipException;
import com.roomcast.model.Packet;

class JacksonPacketEncoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final JacksonPacketEncoder encoder = new JacksonPacketEncoder(objectMapper);

    @Test
    void encodesPacketAsSingleJsonFrame() throws Exception {
        Packet packet = Packet.of("message", Map.of("text", "hi"));
        packet.setNamespace("/chat");
        packet.setTimestamp(LocalDateTime.of(2024, 1, 2, 3, 4, 5));

        List<byte[]> frames = encoder.encode(packet);

        assertThat(frames).hasSize(1);
        JsonNode json = objectMapper.readTree(new String(frames.get(0), StandardCharsets.UTF_8));
        assertThat(json.get("type").asText()).isEqualTo("message");
        assertThat(json.get("namespace").asText()).isEqualTo("/chat");
        assertThat(json.get("data").get("text").asText()).isEqualTo("hi");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-02T03:04:05");
    }

    @Test
    void omitsNullFields() throws Exception {
        Packet packet = Packet.of("ping", null);

        JsonNode json = objectMapper.readTree(encoder.encode(packet).get(0));

        assertThat(json.has("data")).isFalse();
        assertThat(json.has("namespace")).isFalse();
    }

    @Test
    void unserializablePayloadRaisesEncodingFailed() {
        Packet packet = Packet.of("broken", new Object());

        assertThatThrownBy(() -> encoder.encode(packet))
                .isInstanceOf(MembershipException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ENCODING_FAILED);
    }
}
