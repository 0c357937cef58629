package com.roomcast.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomcast.event.LoggingLifecycleListener;
import com.roomcast.transport.JacksonPacketEncoder;
import com.roomcast.transport.PacketEncoder;
import com.roomcast.transport.SocketDirectory;
import com.roomcast.transport.SocketLookup;

/**
 * Default transport beans and the lifecycle logging listener.
 *
 * Runs after the host's own configuration, so a host that declares a {@link SocketLookup} or
 * {@link PacketEncoder} bean replaces the matching default here.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
public class RoomcastAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SocketLookup.class)
    public SocketDirectory socketDirectory() {
        return new SocketDirectory();
    }

    @Bean
    @ConditionalOnMissingBean(PacketEncoder.class)
    public PacketEncoder packetEncoder(ObjectMapper objectMapper) {
        return new JacksonPacketEncoder(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "roomcast", name = "lifecycle-logging", havingValue = "true", matchIfMissing = true)
    public LoggingLifecycleListener loggingLifecycleListener() {
        return new LoggingLifecycleListener();
    }
}
