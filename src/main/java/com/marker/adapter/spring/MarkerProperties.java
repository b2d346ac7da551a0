package com.marker.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for marker evaluation.
 */
@ConfigurationProperties(prefix = "marker")
public class MarkerProperties {

    /**
     * Whether marker evaluation is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the marker configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:marker-environment.yaml";

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
}
