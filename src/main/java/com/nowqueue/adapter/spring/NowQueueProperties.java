package com.nowqueue.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the Now Queue engine.
 */
@ConfigurationProperties(prefix = "nowqueue")
public class NowQueueProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the engine configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:nowqueue.yaml";

    /**
     * Optional JSON task export used to seed the in-memory task store.
     */
    private String snapshotPath;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(String snapshotPath) {
        this.snapshotPath = snapshotPath;
    }
}
