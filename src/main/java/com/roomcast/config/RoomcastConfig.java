package com.roomcast.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import com.roomcast.event.RoomLifecycleListener;
import com.roomcast.service.MembershipRegistry;

/**
 * Attaches the lifecycle listener beans to the registry once the application is ready
 */
@Configuration
public class RoomcastConfig {
    private static final Logger logger = LoggerFactory.getLogger(RoomcastConfig.class);

    private final MembershipRegistry membershipRegistry;
    private final ObjectProvider<RoomLifecycleListener> lifecycleListeners;
    private final RoomcastProperties properties;

    public RoomcastConfig(MembershipRegistry membershipRegistry,
                          ObjectProvider<RoomLifecycleListener> lifecycleListeners,
                          RoomcastProperties properties) {
        this.membershipRegistry = membershipRegistry;
        this.lifecycleListeners = lifecycleListeners;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerLifecycleListeners() {
        lifecycleListeners.orderedStream().forEach(membershipRegistry::addListener);
        logger.info("Roomcast ready: namespace={}, lifecycleLogging={}, defaultCompress={}",
                properties.getNamespace(), properties.isLifecycleLogging(), properties.getDispatch().isCompress());
    }
}
