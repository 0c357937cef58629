package com.roomcast.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the membership core
 * Binds to roomcast.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "roomcast")
public class RoomcastProperties {

    private String namespace = "/";
    private boolean lifecycleLogging = true;

    private DispatchSettings dispatch = new DispatchSettings();

    // Getters and setters
    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public boolean isLifecycleLogging() {
        return lifecycleLogging;
    }

    public void setLifecycleLogging(boolean lifecycleLogging) {
        this.lifecycleLogging = lifecycleLogging;
    }

    public DispatchSettings getDispatch() {
        return dispatch;
    }

    public void setDispatch(DispatchSettings dispatch) {
        this.dispatch = dispatch;
    }

    public static class DispatchSettings {
        // Used when a broadcast leaves the compress flag unset
        private boolean compress = true;

        public boolean isCompress() {
            return compress;
        }

        public void setCompress(boolean compress) {
            this.compress = compress;
        }
    }
}
